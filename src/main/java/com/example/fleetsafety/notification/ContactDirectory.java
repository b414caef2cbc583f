package com.example.fleetsafety.notification;

import com.example.fleetsafety.config.ContactPoint;
import com.example.fleetsafety.domain.NotificationRecipient;

import java.util.Map;

/**
 * Resolves who can be reached for an alert, keyed by recipient type.
 * Iteration order of the returned map is the fallback contact order.
 */
public interface ContactDirectory {

    Map<NotificationRecipient.RecipientType, ContactPoint> resolve(Long companyId, String vehicleId, String driverId);
}
