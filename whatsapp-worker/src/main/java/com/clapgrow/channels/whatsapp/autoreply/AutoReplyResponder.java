package com.clapgrow.channels.whatsapp.autoreply;

import java.util.Optional;

/**
 * External text generator that answers inbound messages.
 */
public interface AutoReplyResponder {

    /**
     * @return the reply text, or empty when the responder chose not to reply
     * @throws com.clapgrow.channels.whatsapp.exception.ConfigurationException when the responder is not configured
     */
    Optional<String> reply(ResponderRequest request);
}
