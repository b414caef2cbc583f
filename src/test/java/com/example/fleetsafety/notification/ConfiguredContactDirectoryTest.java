package com.example.fleetsafety.notification;

import com.example.fleetsafety.config.CompanyConfig;
import com.example.fleetsafety.config.CompanyConfigResolver;
import com.example.fleetsafety.config.ContactPoint;
import com.example.fleetsafety.domain.NotificationRecipient;
import com.example.fleetsafety.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.example.fleetsafety.testutil.TestDataFactory.COMPANY_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConfiguredContactDirectoryTest {

    @Mock private CompanyConfigResolver configResolver;

    @Test
    void resolve_keysContactsByRecipientTypeInConfigOrder() {
        when(configResolver.resolve(COMPANY_ID)).thenReturn(TestDataFactory.createConfigWithContacts());

        Map<NotificationRecipient.RecipientType, ContactPoint> contacts =
                new ConfiguredContactDirectory(configResolver).resolve(COMPANY_ID, "veh-1", null);

        assertThat(contacts.keySet()).containsExactly(NotificationRecipient.RecipientType.MONITORING_TEAM,
                NotificationRecipient.RecipientType.SUPERVISOR);
        assertThat(contacts.get(NotificationRecipient.RecipientType.SUPERVISOR).getPhone()).isEqualTo("+15550000002");
    }

    @Test
    void resolve_unknownTypesCollapseToFirstOther() {
        CompanyConfig config = CompanyConfig.builtIn();
        Map<String, ContactPoint> raw = new LinkedHashMap<>();
        raw.put("fleet_manager", new ContactPoint("Fleet Manager", "+1000", null, 3));
        raw.put("yard", new ContactPoint("Yard", "+2000", null, 4));
        raw.put("owner", null);
        config.setContacts(raw);
        when(configResolver.resolve(COMPANY_ID)).thenReturn(config);

        Map<NotificationRecipient.RecipientType, ContactPoint> contacts =
                new ConfiguredContactDirectory(configResolver).resolve(COMPANY_ID, null, null);

        assertThat(contacts).hasSize(1);
        assertThat(contacts.get(NotificationRecipient.RecipientType.OTHER).getName()).isEqualTo("Fleet Manager");
    }

    @Test
    void resolve_noContactsConfigured_isEmpty() {
        CompanyConfig config = CompanyConfig.builtIn();
        config.setContacts(null);
        when(configResolver.resolve(COMPANY_ID)).thenReturn(config);

        assertThat(new ConfiguredContactDirectory(configResolver).resolve(COMPANY_ID, null, null)).isEmpty();
    }
}
