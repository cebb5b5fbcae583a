package io.github.hotbrkm.outreach.dispatcher.send.transport;

import io.github.hotbrkm.outreach.dispatcher.campaign.CampaignState;
import io.github.hotbrkm.outreach.dispatcher.campaign.Contact;

@FunctionalInterface
public interface MessagePreparer {

    OutreachMessage prepare(CampaignState campaign, Contact contact);
}
