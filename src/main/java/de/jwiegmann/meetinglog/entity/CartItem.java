package de.jwiegmann.meetinglog.entity;

import lombok.Value;

/**
 * Ein noch nicht festgeschriebener Eintrag im Warenkorb einer Session.
 */
@Value
public class CartItem {

    String content;
    Attachment attachment; // optional

    public boolean hasAttachment() {
        return attachment != null;
    }
}
