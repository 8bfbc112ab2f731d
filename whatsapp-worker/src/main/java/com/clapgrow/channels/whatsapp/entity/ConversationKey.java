package com.clapgrow.channels.whatsapp.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConversationKey implements Serializable {
    private String channelId;
    private String jid;
}
