package io.b2mash.eventops.notification.template;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Substitutes {@code {{name}}} placeholders in campaign subjects and bodies.
 *
 * <p>Order of passes: {@code {{event_date+N}}} / {@code {{event_date-N}}} are computed against the
 * ISO anchor date under {@link #EVENT_DATE_ANCHOR}; then every non-internal key is substituted
 * literally; finally any placeholder still left is removed, so unknown or missing variables never
 * reach a recipient.
 */
@Component
public class TemplateVariableRenderer {

  /** Internal key holding the ISO event date used for date arithmetic. Never rendered itself. */
  public static final String EVENT_DATE_ANCHOR = "_event_date_iso";

  public static final DateTimeFormatter GERMAN_DATE = DateTimeFormatter.ofPattern("dd.MM.yyyy");

  private static final Pattern DATE_MATH = Pattern.compile("\\{\\{event_date([+-]\\d+)\\}\\}");
  private static final Pattern ANY_PLACEHOLDER = Pattern.compile("\\{\\{[^}]+\\}\\}");

  public String render(String template, Map<String, String> variables) {
    if (template == null) {
      return "";
    }
    String result = applyDateMath(template, variables.get(EVENT_DATE_ANCHOR));

    for (var entry : variables.entrySet()) {
      if (entry.getKey().startsWith("_") || entry.getValue() == null) {
        continue;
      }
      result = result.replace("{{" + entry.getKey() + "}}", entry.getValue());
    }

    return ANY_PLACEHOLDER.matcher(result).replaceAll("");
  }

  public static String formatGermanDate(LocalDate date) {
    return date != null ? GERMAN_DATE.format(date) : "";
  }

  private static String applyDateMath(String template, String anchorIso) {
    if (anchorIso == null || anchorIso.isBlank()) {
      return template;
    }
    LocalDate anchor;
    try {
      anchor = LocalDate.parse(anchorIso.length() > 10 ? anchorIso.substring(0, 10) : anchorIso);
    } catch (DateTimeParseException e) {
      return template;
    }
    Matcher matcher = DATE_MATH.matcher(template);
    var out = new StringBuilder();
    while (matcher.find()) {
      int offset = Integer.parseInt(matcher.group(1));
      matcher.appendReplacement(
          out, Matcher.quoteReplacement(formatGermanDate(anchor.plusDays(offset))));
    }
    matcher.appendTail(out);
    return out.toString();
  }
}
