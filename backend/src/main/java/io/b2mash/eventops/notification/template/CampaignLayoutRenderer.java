package io.b2mash.eventops.notification.template;

import java.time.Year;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

/**
 * Wraps an already substituted campaign body in the branded HTML layout ({@code
 * templates/email/campaign-layout.html}) and derives the plain-text alternative.
 */
@Service
public class CampaignLayoutRenderer {

  private static final Logger log = LoggerFactory.getLogger(CampaignLayoutRenderer.class);

  private final TemplateEngine emailTemplateEngine;

  public CampaignLayoutRenderer() {
    this.emailTemplateEngine = createEmailTemplateEngine();
  }

  /**
   * @param unsubscribeUrl footer link for parent mail; null omits the footer link
   */
  public RenderedEmail render(String subject, String bodyHtml, String unsubscribeUrl) {
    var ctx = new Context();
    ctx.setVariable("subject", subject);
    ctx.setVariable("contentHtml", bodyHtml);
    ctx.setVariable("unsubscribeUrl", unsubscribeUrl);
    ctx.setVariable("year", Year.now().getValue());

    String fullHtml = emailTemplateEngine.process("campaign-layout", ctx);
    log.debug("Rendered campaign layout for '{}', HTML size={}", subject, fullHtml.length());
    return new RenderedEmail(subject, fullHtml, toPlainText(fullHtml));
  }

  /**
   * Strips HTML tags to produce a plain-text fallback body. Link text keeps its URL in
   * parentheses.
   */
  String toPlainText(String html) {
    if (html == null || html.isBlank()) {
      return "";
    }

    String text = html;
    text = text.replaceAll("(?is)<head>.*?</head>", "");
    text = text.replaceAll("<a[^>]*href=\"([^\"]*)\"[^>]*>([^<]*)</a>", "$2 ($1)");
    text = text.replaceAll("<br\\s*/?>", "\n");
    text = text.replaceAll("</p>", "\n\n");
    text = text.replaceAll("</div>", "\n");
    text = text.replaceAll("</tr>", "\n");
    text = text.replaceAll("</td>", " ");
    text = text.replaceAll("<[^>]+>", "");

    text = text.replace("&amp;", "&");
    text = text.replace("&lt;", "<");
    text = text.replace("&gt;", ">");
    text = text.replace("&quot;", "\"");
    text = text.replace("&nbsp;", " ");
    text = text.replace("&#39;", "'");
    text = text.replace("&copy;", "(c)");
    text = text.replace("&middot;", "-");

    text = text.replaceAll("[ \\t]+", " ");
    text = text.replaceAll("\\n[ \\t]+", "\n");
    text = text.replaceAll("\\n{3,}", "\n\n");
    return text.strip();
  }

  private static TemplateEngine createEmailTemplateEngine() {
    var engine = new TemplateEngine();

    var resolver = new ClassLoaderTemplateResolver();
    resolver.setPrefix("templates/email/");
    resolver.setSuffix(".html");
    resolver.setTemplateMode(TemplateMode.HTML);
    resolver.setCharacterEncoding("UTF-8");
    resolver.setCacheable(true);

    engine.setTemplateResolver(resolver);
    return engine;
  }
}
