package io.github.hotbrkm.outreach.dispatcher.campaign;

import java.util.Objects;

/**
 * One campaign recipient.
 */
public record Contact(String email, String companyName) {

    public Contact {
        Objects.requireNonNull(email, "email must not be null");
        email = email.trim();
        companyName = companyName == null ? "" : companyName.trim();
    }
}
