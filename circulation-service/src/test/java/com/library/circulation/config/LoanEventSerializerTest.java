package com.library.circulation.config;

import com.library.circulation.dto.LoanEvent;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class LoanEventSerializerTest {

    private final LoanEventSerializer serializer = new LoanEventSerializer();

    @Test
    void writesIsoDates() {
        OffsetDateTime due = OffsetDateTime.of(2026, 3, 24, 12, 0, 0, 0, ZoneOffset.UTC);
        LoanEvent event = new LoanEvent(LoanEvent.Type.LOAN_CREATED, UUID.randomUUID(), UUID.randomUUID(),
            UUID.randomUUID(), due, null, due.minusDays(14));

        String json = new String(serializer.serialize("loan.created", event), StandardCharsets.UTF_8);

        assertThat(json).contains("\"type\":\"LOAN_CREATED\"").contains("\"dueDate\":\"2026-03-24T12:00:00Z\"");
    }

    @Test
    void nullPayloadStaysNull() {
        assertThat(serializer.serialize("loan.created", null)).isNull();
    }
}
