package com.meltwater.rxqueue.example;

import com.meltwater.rxqueue.AmqpQueue;
import com.meltwater.rxqueue.BindOptions;
import com.meltwater.rxqueue.ChannelSettings;
import com.meltwater.rxqueue.DeclareCallback;
import com.meltwater.rxqueue.DeliveryCallback;
import com.meltwater.rxqueue.Exchange;
import com.meltwater.rxqueue.Metadata;
import com.meltwater.rxqueue.QueueOptions;
import com.meltwater.rxqueue.SubscribeOptions;
import com.meltwater.rxqueue.impl.RabbitQueueChannel;
import com.meltwater.rxqueue.util.Logger;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicLong;

/**
 * An example app which consumes from a durable work queue and from a server-named queue bound to the same exchange.
 */
public class ExampleQueueApp {

    private static final Logger log = new Logger(ExampleQueueApp.class);

    public static void main(String[] args) throws Exception {
        Properties prop = new Properties();
        prop.load(ExampleQueueApp.class.getResourceAsStream("/example_app.properties"));
        prop.putAll(System.getProperties());

        ConnectionFactory connectionFactory = new ConnectionFactory();
        connectionFactory.setUri(prop.getProperty("rabbit.broker.uri"));
        Connection connection = connectionFactory.newConnection("rxqueue-example-app");

        final ExampleQueueApp app = new ExampleQueueApp(
                connection,
                new Exchange(prop.getProperty("rabbit.input.exchange")),
                prop.getProperty("rabbit.input.routing.key", ""),
                prop.getProperty("rabbit.work.queue"),
                new ChannelSettings().withPreFetchCount(Integer.parseInt(prop.getProperty("rabbit.prefetch.count", "0")))
        );
        app.start();

        final CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.infoWithParams("Closing app ...");
            app.stop();
            stopped.countDown();
        }));

        //Wait for Ctrl+C
        stopped.await();
    }

    private final Connection connection;
    private final Exchange exchange;
    private final String routingKey;
    private final String workQueueName;
    private final RabbitQueueChannel channel;
    private final AtomicLong handled = new AtomicLong();

    private AmqpQueue workQueue;
    private AmqpQueue tapQueue;

    public ExampleQueueApp(Connection connection,
                           Exchange exchange,
                           String routingKey,
                           String workQueueName,
                           ChannelSettings settings) {
        this.connection = connection;
        this.exchange = exchange;
        this.routingKey = routingKey;
        this.workQueueName = workQueueName;
        this.channel = new RabbitQueueChannel(connection, settings);
    }

    void start() {
        workQueue = new AmqpQueue(channel, workQueueName, new QueueOptions().withDurable(true))
                .bind(exchange, new BindOptions().withKey(routingKey))
                .subscribe(new SubscribeOptions()
                                .withAck(true)
                                .withConfirm(ok -> log.infoWithParams("Work queue consumer ready.", "consumerTag", ok.getConsumerTag())),
                        DeliveryCallback.withMetadata(this::handleJob));

        //the broker names this queue, bindings wait for the name
        tapQueue = new AmqpQueue(channel, "", new QueueOptions().withExclusive(true).withAutoDelete(true),
                DeclareCallback.onDeclareOk((queue, ok) -> log.infoWithParams("Tap queue declared.", "queue", ok.getQueue())))
                .bind(exchange, new BindOptions().withKey(routingKey))
                .subscribe(DeliveryCallback.payloadOnly(payload ->
                        log.debugWithParams("Tapped message.", "payload", new String(payload, StandardCharsets.UTF_8))));

        channel.open();
    }

    private void handleJob(Metadata metadata, byte[] payload) {
        try {
            //change in logback.xml to DEBUG level to see every message payload logged
            log.debugWithParams("Received job.",
                    "payload", new String(payload, StandardCharsets.UTF_8),
                    "routingKey", metadata.getRoutingKey(),
                    "messageId", metadata.getMessageId());
            metadata.ack();
            if (handled.incrementAndGet() % 1000 == 0) {
                workQueue.status((messages, consumers) -> log.infoWithParams("Work queue status.",
                        "handled", handled.get(),
                        "messages", messages,
                        "consumers", consumers));
            }
        } catch (RuntimeException e) {
            log.errorWithParams("Could not handle job, rejecting it.", e,
                    "deliveryTag", metadata.getDeliveryTag());
            metadata.reject(false);
        }
    }

    void stop() {
        workQueue.unsubscribe();
        tapQueue.unsubscribe();
        channel.close();
        try {
            connection.close();
        } catch (IOException e) {
            log.warnWithParams("Error when closing the connection.", e);
        }
    }
}
