package com.realtime.teamhub.notify;

import com.realtime.teamhub.config.RabbitConfig;
import com.realtime.teamhub.realtime.protocol.OutboundEventType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.net.ConnectException;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotificationPublisherTest {

    @Mock RabbitTemplate rabbitTemplate;
    @InjectMocks NotificationPublisher publisher;

    @Test
    void publishesToFanoutExchange() {
        UUID user = UUID.randomUUID();
        UUID org = UUID.randomUUID();

        assertTrue(publisher.publish(user, org, OutboundEventType.UNREAD_COUNT, Map.of("count", 2L)));

        ArgumentCaptor<Object> body = ArgumentCaptor.forClass(Object.class);
        verify(rabbitTemplate).convertAndSend(eq(RabbitConfig.NOTIFY_EXCHANGE), eq(""), body.capture());
        NotificationEvent event = (NotificationEvent) body.getValue();
        assertEquals(user, event.getUserId());
        assertEquals(org, event.getOrgId());
        assertEquals("unread_count", event.getType());
        assertEquals(2L, event.getPayload().get("count"));
    }

    @Test
    void brokerOutageIsReportedNotThrown() {
        doThrow(new AmqpConnectException(new ConnectException("refused")))
                .when(rabbitTemplate).convertAndSend(anyString(), anyString(), any(Object.class));

        boolean ok = publisher.publish(UUID.randomUUID(), UUID.randomUUID(), OutboundEventType.INBOX_READ, Map.of());

        assertFalse(ok);
    }
}
