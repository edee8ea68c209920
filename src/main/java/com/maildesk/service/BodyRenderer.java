package com.maildesk.service;

import com.maildesk.domain.Member;
import com.maildesk.extract.ExtractedMessage;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders a message body as a standalone HTML document with a membership information block
 */
@Component
public class BodyRenderer {

    static final String NO_CONTENT = "(No message content)";

    private static final Pattern BODY_END = Pattern.compile("</body\\s*>", Pattern.CASE_INSENSITIVE);

    public String render(ExtractedMessage message, Optional<Member> member, String membershipRef) {
        String body = message.getBody();
        String html;
        if (body == null || body.isBlank()) {
            html = "<html><body><pre>" + NO_CONTENT + "</pre></body></html>";
        } else if (message.isBodyHtml()) {
            html = body;
        } else {
            html = "<html><body><pre>" + HtmlUtils.htmlEscape(body) + "</pre></body></html>";
        }

        String block = membershipBlock(member, membershipRef);
        Matcher m = BODY_END.matcher(html);
        if (m.find()) {
            return html.substring(0, m.start()) + block + html.substring(m.start());
        }
        return html + block;
    }

    private String membershipBlock(Optional<Member> member, String membershipRef) {
        StringBuilder sb = new StringBuilder("<hr><div><strong>Membership Information</strong></div>");
        if (member.isPresent()) {
            Member m = member.get();
            sb.append("<ul>");
            item(sb, "FFNUM", m.getFfnum());
            item(sb, "Title", m.getTitle());
            item(sb, "First Name", m.getFname());
            item(sb, "Last Name", m.getLname());
            item(sb, "Tier", m.getTier());
            sb.append("</ul>");
        } else {
            String ref = membershipRef == null || membershipRef.isBlank() ? "N/A" : membershipRef;
            sb.append("<p>No record found for FFNUM <em>").append(HtmlUtils.htmlEscape(ref)).append("</em>.</p>");
        }
        return sb.toString();
    }

    private static void item(StringBuilder sb, String label, String value) {
        sb.append("<li><strong>").append(label).append(":</strong> ")
                .append(value == null ? "" : HtmlUtils.htmlEscape(value))
                .append("</li>");
    }
}
