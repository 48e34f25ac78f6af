package com.realtime.teamhub.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.amqp.core.*;
import org.springframework.amqp.rabbit.annotation.EnableRabbit;
import org.springframework.amqp.rabbit.config.SimpleRabbitListenerContainerFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.DefaultJackson2JavaTypeMapper;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableRabbit
public class RabbitConfig {

    // 인박스 알림: 모든 인스턴스가 받아서 자기 연결에만 전달
    public static final String NOTIFY_EXCHANGE = "teamhub.notifications";
    // 채팅 스코프 브로드캐스트 (app.realtime.cluster-fanout=true 일 때만 사용)
    public static final String SCOPE_EXCHANGE = "teamhub.scope-broadcast";

    @Bean
    public FanoutExchange notificationExchange() {
        return ExchangeBuilder.fanoutExchange(NOTIFY_EXCHANGE).durable(true).build();
    }

    /** 인스턴스 전용 익명 큐 (exclusive, auto-delete). 프로세스가 내려가면 같이 사라짐 */
    @Bean
    public Queue notificationRelayQueue() {
        return new AnonymousQueue();
    }

    @Bean
    public Binding notificationRelayBinding() {
        return BindingBuilder.bind(notificationRelayQueue()).to(notificationExchange());
    }

    @Bean
    public Jackson2JsonMessageConverter jackson2JsonMessageConverter(ObjectMapper objectMapper) {
        Jackson2JsonMessageConverter conv = new Jackson2JsonMessageConverter(objectMapper);
        DefaultJackson2JavaTypeMapper typeMapper = new DefaultJackson2JavaTypeMapper();
        typeMapper.setTrustedPackages("com.realtime.teamhub.*", "java.util", "java.lang");
        conv.setJavaTypeMapper(typeMapper);
        return conv;
    }

    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory cf, Jackson2JsonMessageConverter conv) {
        RabbitTemplate rt = new RabbitTemplate(cf);
        rt.setMessageConverter(conv);
        return rt;
    }

    /**
     * 브리지 리스너: auto-ack (at-most-once), 재큐잉 없음, 큐당 컨슈머 1개.
     * 브로커가 없으면 컨테이너가 백그라운드에서 재연결을 계속 시도한다.
     */
    @Bean
    public SimpleRabbitListenerContainerFactory rabbitListenerContainerFactory(
            ConnectionFactory cf, Jackson2JsonMessageConverter conv) {
        SimpleRabbitListenerContainerFactory f = new SimpleRabbitListenerContainerFactory();
        f.setConnectionFactory(cf);
        f.setMessageConverter(conv);
        f.setAcknowledgeMode(AcknowledgeMode.NONE);
        f.setDefaultRequeueRejected(false);
        f.setConcurrentConsumers(1);
        f.setMaxConcurrentConsumers(1);
        f.setMissingQueuesFatal(false);
        return f;
    }

    @Configuration
    @ConditionalOnProperty(prefix = "app.realtime", name = "cluster-fanout", havingValue = "true")
    static class ScopeFanoutConfig {

        @Bean
        public FanoutExchange scopeBroadcastExchange() {
            return ExchangeBuilder.fanoutExchange(SCOPE_EXCHANGE).durable(true).build();
        }

        @Bean
        public Queue scopeBroadcastQueue() {
            return new AnonymousQueue();
        }

        @Bean
        public Binding scopeBroadcastBinding() {
            return BindingBuilder.bind(scopeBroadcastQueue()).to(scopeBroadcastExchange());
        }
    }
}
