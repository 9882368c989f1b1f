package io.b2mash.b2b.tenantcore.multitenancy;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rejects statements that would move a {@link SchemaSession} off its schema: active-schema
 * directives and qualified references to any other tenant schema. References to the shared schema
 * stay allowed.
 *
 * <p>Statements are checked both as written and with comments removed, so a comment cannot split a
 * qualified name or a directive.
 */
final class SessionStatementGuard {

  private static final Pattern SCHEMA_DIRECTIVE =
      Pattern.compile(
          "\\b(set\\s+(session\\s+|local\\s+)?(search_path|schema)\\b"
              + "|reset\\s+search_path\\b"
              + "|set_config\\s*\\(\\s*'search_path')",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern TENANT_QUALIFIER =
      Pattern.compile("\"?\\b(tenant_[a-z0-9_]+)\"?\\s*\\.", Pattern.CASE_INSENSITIVE);

  private static final Pattern DOLLAR_TAG = Pattern.compile("\\$([A-Za-z_][A-Za-z0-9_]*)?\\$");

  private final SchemaName schema;

  SessionStatementGuard(SchemaName schema) {
    this.schema = schema;
  }

  void check(String sql) {
    if (sql == null) {
      return;
    }
    checkText(sql);
    checkText(stripComments(sql));
  }

  private void checkText(String sql) {
    if (SCHEMA_DIRECTIVE.matcher(sql).find()) {
      throw new ContextMisuseException(
          "Statements that change the active schema are not allowed in a session bound to "
              + schema);
    }
    Matcher matcher = TENANT_QUALIFIER.matcher(sql);
    while (matcher.find()) {
      String referenced = matcher.group(1).toLowerCase(Locale.ROOT);
      if (!referenced.equals(schema.value())) {
        throw new ContextMisuseException(
            "Session bound to " + schema + " cannot reference schema " + referenced);
      }
    }
  }

  /**
   * Replaces every comment outside literals and quoted identifiers with a single space. Understands
   * standard, escape ({@code E'...'}) and dollar-quoted strings, and nested block comments.
   */
  static String stripComments(String sql) {
    StringBuilder out = new StringBuilder(sql.length());
    int length = sql.length();
    int i = 0;
    while (i < length) {
      char c = sql.charAt(i);
      char next = i + 1 < length ? sql.charAt(i + 1) : '\0';
      if (c == '-' && next == '-') {
        int newline = sql.indexOf('\n', i);
        i = newline < 0 ? length : newline;
        out.append(' ');
        continue;
      }
      if (c == '/' && next == '*') {
        i = endOfBlockComment(sql, i);
        out.append(' ');
        continue;
      }
      int end = i + 1;
      if (c == '\'') {
        end = closingQuote(sql, i, '\'', isEscapeString(sql, i));
      } else if (c == '"') {
        end = closingQuote(sql, i, '"', false);
      } else if (c == '$') {
        end = Math.max(end, closingDollarQuote(sql, i));
      }
      out.append(sql, i, end);
      i = end;
    }
    return out.toString();
  }

  private static boolean isEscapeString(String sql, int quote) {
    if (quote == 0) {
      return false;
    }
    char prefix = sql.charAt(quote - 1);
    if (prefix != 'E' && prefix != 'e') {
      return false;
    }
    return quote < 2
        || (!Character.isLetterOrDigit(sql.charAt(quote - 2)) && sql.charAt(quote - 2) != '_');
  }

  private static int closingQuote(String sql, int start, char quote, boolean backslashEscapes) {
    int i = start + 1;
    while (i < sql.length()) {
      char c = sql.charAt(i);
      if (backslashEscapes && c == '\\') {
        i += 2;
      } else if (c == quote) {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
          i += 2;
        } else {
          return i + 1;
        }
      } else {
        i++;
      }
    }
    return sql.length();
  }

  /** Returns the index after a dollar-quoted string starting at {@code start}, or {@code start}. */
  private static int closingDollarQuote(String sql, int start) {
    if (start > 0 && Character.isLetterOrDigit(sql.charAt(start - 1))) {
      return start;
    }
    Matcher tag = DOLLAR_TAG.matcher(sql);
    tag.region(start, sql.length());
    if (!tag.lookingAt()) {
      return start;
    }
    String delimiter = tag.group();
    int close = sql.indexOf(delimiter, tag.end());
    return close < 0 ? sql.length() : close + delimiter.length();
  }

  private static int endOfBlockComment(String sql, int start) {
    int depth = 0;
    int i = start;
    while (i < sql.length()) {
      if (sql.startsWith("/*", i)) {
        depth++;
        i += 2;
      } else if (sql.startsWith("*/", i)) {
        depth--;
        i += 2;
        if (depth == 0) {
          return i;
        }
      } else {
        i++;
      }
    }
    return sql.length();
  }
}
