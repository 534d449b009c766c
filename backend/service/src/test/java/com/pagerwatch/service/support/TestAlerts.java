package com.pagerwatch.service.support;

import com.pagerwatch.core.model.Alert;
import com.pagerwatch.core.model.Priority;
import com.pagerwatch.core.model.Protocol;
import com.pagerwatch.core.model.Service;

import java.time.Instant;
import java.util.List;

public final class TestAlerts {
    private TestAlerts() {
    }

    public static Alert alert(Instant timestamp, String body, Service service, Priority priority, String... capcodes) {
        return new Alert(
                Alert.UNASSIGNED_ID,
                timestamp,
                timestamp,
                Protocol.FLEX,
                "ALN",
                "",
                List.of(capcodes),
                body,
                service,
                priority,
                null,
                List.of(),
                List.of()
        );
    }

    public static Alert alert(Instant timestamp, String body) {
        return alert(timestamp, body, Service.UNKNOWN, Priority.UNKNOWN, "0000001");
    }
}
