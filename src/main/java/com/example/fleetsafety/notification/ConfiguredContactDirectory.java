package com.example.fleetsafety.notification;

import com.example.fleetsafety.config.CompanyConfigResolver;
import com.example.fleetsafety.config.ContactPoint;
import com.example.fleetsafety.domain.NotificationRecipient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Company-wide contacts from {@code contacts} in the company configuration.
 * Vehicle and driver specific contacts are not known here.
 */
@Component
@RequiredArgsConstructor
public class ConfiguredContactDirectory implements ContactDirectory {

    private final CompanyConfigResolver configResolver;

    @Override
    public Map<NotificationRecipient.RecipientType, ContactPoint> resolve(Long companyId, String vehicleId,
                                                                           String driverId) {
        Map<NotificationRecipient.RecipientType, ContactPoint> resolved = new LinkedHashMap<>();
        Map<String, ContactPoint> contacts = configResolver.resolve(companyId).getContacts();
        if (contacts != null) {
            contacts.forEach((type, contact) -> {
                if (contact != null) {
                    resolved.putIfAbsent(NotificationRecipient.RecipientType.fromValue(type), contact);
                }
            });
        }
        return resolved;
    }
}
