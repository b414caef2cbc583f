package com.example.fleetsafety.notification;

import com.example.fleetsafety.domain.NotificationRecipient;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecipientDraft {

    private NotificationRecipient.RecipientType recipientType;
    private String name;
    private String phone;
    private String whatsapp;
    private Integer priority;
}
