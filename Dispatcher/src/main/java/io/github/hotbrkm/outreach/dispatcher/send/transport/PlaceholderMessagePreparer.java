package io.github.hotbrkm.outreach.dispatcher.send.transport;

import io.github.hotbrkm.outreach.dispatcher.campaign.CampaignState;
import io.github.hotbrkm.outreach.dispatcher.campaign.Contact;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders the campaign subject and template by substituting {@code {{name}}} placeholders.
 * <p>
 * Supported names are {@code company_name}, {@code companyName} and {@code email}.
 * Unknown placeholders are left untouched.
 */
public class PlaceholderMessagePreparer implements MessagePreparer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z_]+)\\s*}}");

    @Override
    public OutreachMessage prepare(CampaignState campaign, Contact contact) {
        String company = contact.companyName() == null ? "" : contact.companyName();
        Map<String, String> values = Map.of(
                "company_name", company,
                "companyName", company,
                "email", contact.email());
        return new OutreachMessage(campaign.getId(), contact.email(), company,
                render(campaign.getSubject(), values), render(campaign.getTemplate(), values), campaign.getAttachments());
    }

    static String render(String source, Map<String, String> values) {
        if (source == null || source.isEmpty()) {
            return "";
        }
        Matcher matcher = PLACEHOLDER.matcher(source);
        StringBuilder out = new StringBuilder(source.length());
        while (matcher.find()) {
            String replacement = values.getOrDefault(matcher.group(1), matcher.group(0));
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
