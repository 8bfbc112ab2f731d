package com.clapgrow.channels.whatsapp.exception;

import com.clapgrow.channels.common.provider.ProviderErrorCategory;
import com.clapgrow.channels.whatsapp.transport.CloseReason;

/**
 * The linked device was removed on the phone; only a new pairing can bring the channel back.
 */
public class SessionLoggedOutException extends TransportException {

    public SessionLoggedOutException(String message) {
        super(message, CloseReason.LOGGED_OUT, ProviderErrorCategory.AUTH);
    }
}
