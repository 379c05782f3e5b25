package com.meltwater.rxqueue;

import com.google.common.collect.ImmutableMap;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.impl.AMQImpl;
import org.junit.Before;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class AmqpQueueTest {

    private RecordingQueueChannel channel;

    @Before
    public void setup() {
        channel = new RecordingQueueChannel();
    }

    @Test
    public void named_queue_without_callback_is_opened_right_away() {
        AmqpQueue queue = new AmqpQueue(channel, "jobs", new QueueOptions().withDurable(true));

        assertThat(queue.getOptions().isNo_wait(), is(true));
        assertThat(queue.getStatus(), equalTo(QueueStatus.OPENED));
        assertThat(queue.getName(), equalTo("jobs"));
        assertThat(channel.calls(), is(empty()));
        assertThat(channel.registered(), contains(queue));

        channel.open();

        RecordingQueueChannel.Call declare = channel.lastCall("queue.declare");
        assertThat(declare.arg("queue"), equalTo("jobs"));
        assertThat(declare.arg("durable"), equalTo(true));
        assertThat(declare.arg("passive"), equalTo(false));
        assertThat(queue.isDeclared(), is(false));

        declare.reply(new AMQImpl.Queue.DeclareOk("jobs", 3, 0));
        assertThat(queue.isDeclared(), is(true));
        assertThat(queue.getStatus(), equalTo(QueueStatus.OPENED));
    }

    @Test
    public void server_named_queue_is_opening_until_declare_ok() {
        AmqpQueue queue = new AmqpQueue(channel, "");

        assertThat(queue.isServerNamed(), is(true));
        assertThat(queue.getOptions().isNo_wait(), is(false));
        assertThat(queue.getStatus(), equalTo(QueueStatus.OPENING));

        channel.open();
        assertThat(queue.getStatus(), equalTo(QueueStatus.OPENING));
        assertThat(queue.getName(), equalTo(""));

        channel.lastCall("queue.declare").reply(new AMQImpl.Queue.DeclareOk("amq.gen-abc", 0, 0));

        assertThat(queue.getStatus(), equalTo(QueueStatus.OPENED));
        assertThat(queue.getName(), equalTo("amq.gen-abc"));
    }

    @Test
    public void named_queue_with_callback_waits_for_declare_ok() {
        List<AMQP.Queue.DeclareOk> replies = new ArrayList<>();
        AmqpQueue queue = new AmqpQueue(channel, "jobs", new QueueOptions(),
                DeclareCallback.onDeclareOk((q, ok) -> replies.add(ok)));

        assertThat(queue.getOptions().isNo_wait(), is(false));
        assertThat(queue.getStatus(), equalTo(QueueStatus.OPENING));

        channel.open();
        RecordingQueueChannel.Call declare = channel.lastCall("queue.declare");
        assertThat(declare.arg("noWait"), equalTo(false));
        assertThat(replies, is(empty()));

        declare.reply(new AMQImpl.Queue.DeclareOk("jobs", 7, 1));

        assertThat(replies.size(), equalTo(1));
        assertThat(replies.get(0).getMessageCount(), equalTo(7));
        assertThat(queue.getStatus(), equalTo(QueueStatus.OPENED));
    }

    @Test
    public void no_wait_declare_with_callback_calls_back_at_construction() {
        List<AmqpQueue> called = new ArrayList<>();
        AmqpQueue queue = new AmqpQueue(channel, "jobs", new QueueOptions().withNoWait(true),
                DeclareCallback.onQueue(called::add));

        assertThat(called, contains(queue));
        assertThat(queue.getStatus(), equalTo(QueueStatus.OPENED));

        channel.open();
        RecordingQueueChannel.Call declare = channel.lastCall("queue.declare");
        assertThat(declare.arg("noWait"), equalTo(true));
        assertThat(declare.hasReplyCallback(), is(false));
        assertThat(queue.isDeclared(), is(true));
    }

    @Test
    public void server_named_queue_can_not_be_declared_with_no_wait() {
        try {
            new AmqpQueue(channel, "", new QueueOptions().withNoWait(true));
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException expected) {
            assertThat(channel.registered(), is(empty()));
        }
    }

    @Test(expected = NullPointerException.class)
    public void queue_name_must_not_be_null() {
        new AmqpQueue(channel, null);
    }

    @Test
    public void bind_without_key_uses_empty_routing_key() {
        AmqpQueue queue = new AmqpQueue(channel, "jobs");
        queue.bind("logs");
        channel.open();

        RecordingQueueChannel.Call bind = channel.lastCall("queue.bind");
        assertThat(bind.arg("queue"), equalTo("jobs"));
        assertThat(bind.arg("exchange"), equalTo("logs"));
        assertThat(bind.arg("routingKey"), equalTo(""));
        assertThat(bind.arg("noWait"), equalTo(true));
        assertThat(queue.getStatus(), equalTo(QueueStatus.UNBOUND));
    }

    @Test
    public void key_takes_precedence_over_routing_key() {
        AmqpQueue queue = new AmqpQueue(channel, "jobs");
        channel.open();
        queue.bind(new Exchange("a"), new BindOptions().withRoutingKey("rk"));
        queue.bind(new Exchange("b"), new BindOptions().withKey("k").withRoutingKey("rk"));

        List<RecordingQueueChannel.Call> binds = channel.calls("queue.bind");
        assertThat(binds.get(0).arg("routingKey"), equalTo("rk"));
        assertThat(binds.get(1).arg("routingKey"), equalTo("k"));
    }

    @Test
    public void rebinding_overwrites_the_registry_entry() {
        AmqpQueue queue = new AmqpQueue(channel, "jobs");
        queue.bind(new Exchange("logs"), new BindOptions().withKey("info"));
        queue.bind(new Exchange("logs"), new BindOptions().withKey("error"));

        assertThat(queue.getBindings().size(), equalTo(1));
        assertThat(queue.getBindings().get(new Exchange("logs")).getKey(), equalTo("error"));

        channel.open();
        assertThat(channel.calls("queue.bind").size(), equalTo(2));
    }

    @Test
    public void bind_with_callback_waits_for_bind_ok() {
        List<AMQP.Queue.BindOk> replies = new ArrayList<>();
        AmqpQueue queue = new AmqpQueue(channel, "jobs");
        channel.open();
        queue.bind(new Exchange("logs"), new BindOptions(), replies::add);

        RecordingQueueChannel.Call bind = channel.lastCall("queue.bind");
        assertThat(bind.arg("noWait"), equalTo(false));
        bind.reply(new AMQImpl.Queue.BindOk());
        assertThat(replies.size(), equalTo(1));
    }

    @Test
    public void operations_before_open_are_sent_in_call_order() {
        AmqpQueue queue = new AmqpQueue(channel, "jobs");
        queue.bind("logs");
        queue.purge();
        queue.subscribe(DeliveryCallback.payloadOnly(payload -> { }));
        queue.delete();

        assertThat(channel.calls(), is(empty()));
        channel.open();

        assertThat(channel.methods(), equalTo(Arrays.asList(
                "queue.declare", "queue.bind", "queue.purge", "basic.consume", "queue.delete")));
    }

    @Test
    public void bind_on_server_named_queue_waits_for_the_declaration() {
        AmqpQueue queue = new AmqpQueue(channel, "");
        queue.bind("logs");
        queue.purge();
        channel.open();

        // purge does not wait for the declaration, the bind does
        assertThat(channel.methods(), equalTo(Arrays.asList("queue.declare", "queue.purge")));

        channel.lastCall("queue.declare").reply(new AMQImpl.Queue.DeclareOk("amq.gen-1", 0, 0));

        assertThat(channel.lastCall("queue.bind").arg("queue"), equalTo("amq.gen-1"));
        assertThat(queue.getStatus(), equalTo(QueueStatus.UNBOUND));
    }

    @Test
    public void unbind_keeps_the_registry_entry() {
        AmqpQueue queue = new AmqpQueue(channel, "jobs");
        channel.open();
        queue.bind(new Exchange("logs"), new BindOptions().withKey("info"));
        queue.unbind(new Exchange("logs"), new BindOptions().withKey("info"), null);

        RecordingQueueChannel.Call unbind = channel.lastCall("queue.unbind");
        assertThat(unbind.arg("exchange"), equalTo("logs"));
        assertThat(unbind.arg("routingKey"), equalTo("info"));
        assertThat(queue.getBindings().contains(new Exchange("logs")), is(true));
    }

    @Test
    public void delete_defaults() {
        AmqpQueue queue = new AmqpQueue(channel, "jobs");
        channel.open();
        queue.delete();

        RecordingQueueChannel.Call delete = channel.lastCall("queue.delete");
        assertThat(delete.arg("ifUnused"), equalTo(false));
        assertThat(delete.arg("ifEmpty"), equalTo(false));
        assertThat(delete.arg("noWait"), equalTo(false));
    }

    @Test
    public void delete_reports_message_count() {
        AtomicReference<AMQP.Queue.DeleteOk> reply = new AtomicReference<>();
        AmqpQueue queue = new AmqpQueue(channel, "jobs");
        channel.open();
        queue.delete(new DeleteOptions().withIfEmpty(true), reply::set);

        RecordingQueueChannel.Call delete = channel.lastCall("queue.delete");
        assertThat(delete.arg("ifEmpty"), equalTo(true));
        delete.reply(new AMQImpl.Queue.DeleteOk(12));
        assertThat(reply.get().getMessageCount(), equalTo(12));
    }

    @Test
    public void purge_reports_message_count() {
        AtomicReference<AMQP.Queue.PurgeOk> reply = new AtomicReference<>();
        AmqpQueue queue = new AmqpQueue(channel, "jobs");
        channel.open();
        queue.purge(new PurgeOptions(), reply::set);

        channel.lastCall("queue.purge").reply(new AMQImpl.Queue.PurgeOk(5));
        assertThat(reply.get().getMessageCount(), equalTo(5));
    }

    @Test
    public void pop_auto_acks_unless_ack_is_requested() {
        AmqpQueue queue = new AmqpQueue(channel, "jobs");
        channel.open();
        queue.pop(DeliveryCallback.payloadOnly(payload -> { }));
        queue.pop(new PopOptions().withAck(true), DeliveryCallback.payloadOnly(payload -> { }));

        List<RecordingQueueChannel.Call> gets = channel.calls("basic.get");
        assertThat(gets.get(0).arg("autoAck"), equalTo(true));
        assertThat(gets.get(1).arg("autoAck"), equalTo(false));
    }

    @Test
    public void pop_hands_over_the_message() {
        List<String> received = new ArrayList<>();
        List<Long> tags = new ArrayList<>();
        AmqpQueue queue = new AmqpQueue(channel, "jobs");
        channel.open();
        queue.pop(new PopOptions().withAck(true), DeliveryCallback.withMetadata((metadata, payload) -> {
            received.add(new String(payload, StandardCharsets.UTF_8));
            tags.add(metadata.getDeliveryTag());
            metadata.ack();
        }));

        channel.lastCall("basic.get").reply(
                RawDelivery.fetched(new Envelope(9, false, "", "jobs"), () -> null, bytes("job-1"), 0));

        assertThat(received, contains("job-1"));
        assertThat(tags, contains(9L));
        assertThat(channel.lastCall("basic.ack").arg("deliveryTag"), equalTo(9L));
    }

    @Test
    public void pop_on_empty_queue_gives_null_payload() {
        List<Boolean> empties = new ArrayList<>();
        AtomicReference<byte[]> payloadRef = new AtomicReference<>(new byte[0]);
        AmqpQueue queue = new AmqpQueue(channel, "jobs");
        channel.open();
        queue.pop(DeliveryCallback.withMetadata((metadata, payload) -> {
            empties.add(metadata.isEmpty());
            payloadRef.set(payload);
        }));

        channel.lastCall("basic.get").reply(RawDelivery.empty());

        assertThat(empties, contains(true));
        assertThat(payloadRef.get(), is(nullValue()));
    }

    @Test
    public void subscribe_consumes_with_a_generated_tag_and_delivers() {
        List<String> received = new ArrayList<>();
        AmqpQueue queue = new AmqpQueue(channel, "jobs");
        queue.subscribe(DeliveryCallback.payloadOnly(payload -> received.add(new String(payload, StandardCharsets.UTF_8))));

        assertThat(queue.getConsumerTag(), equalTo(AmqpQueue.PENDING_CONSUMER_TAG));
        assertThat(queue.isSubscribed(), is(true));

        channel.open();
        RecordingQueueChannel.Call consume = channel.lastCall("basic.consume");
        assertThat((String) consume.arg("consumerTag"), startsWith("rxqueue-jobs-"));
        assertThat(queue.getConsumerTag(), equalTo(consume.arg("consumerTag")));
        assertThat(consume.arg("autoAck"), equalTo(true));
        assertThat(consume.arg("noWait"), equalTo(false));

        consume.deliver(RawDelivery.delivered((String) consume.arg("consumerTag"),
                new Envelope(1, false, "logs", "info"), () -> null, bytes("hello")));
        consume.deliver(RawDelivery.delivered((String) consume.arg("consumerTag"),
                new Envelope(2, false, "logs", "info"), () -> null, bytes("world")));

        assertThat(received, contains("hello", "world"));
    }

    @Test
    public void handler_errors_do_not_end_the_subscription() {
        List<String> received = new ArrayList<>();
        AmqpQueue queue = new AmqpQueue(channel, "jobs");
        channel.open();
        queue.subscribe(DeliveryCallback.payloadOnly(payload -> {
            String message = new String(payload, StandardCharsets.UTF_8);
            received.add(message);
            if (message.equals("bad")) {
                throw new IllegalArgumentException("can not handle " + message);
            }
        }));
        RecordingQueueChannel.Call consume = channel.lastCall("basic.consume");

        consume.deliver(RawDelivery.delivered("t", new Envelope(1, false, "", "jobs"), () -> null, bytes("bad")));
        consume.deliver(RawDelivery.delivered("t", new Envelope(2, false, "", "jobs"), () -> null, bytes("good")));

        assertThat(received, contains("bad", "good"));
    }

    @Test
    public void subscribing_twice_fails_even_before_open() {
        AmqpQueue queue = new AmqpQueue(channel, "jobs");
        queue.subscribe(DeliveryCallback.payloadOnly(payload -> { }));
        try {
            queue.subscribe(DeliveryCallback.payloadOnly(payload -> { }));
            fail("expected IllegalStateException");
        } catch (IllegalStateException expected) {
            assertThat(expected.getMessage(), equalTo("already subscribed to the queue 'jobs'"));
        }
        channel.open();
        assertThat(channel.calls("basic.consume").size(), equalTo(1));
    }

    @Test
    public void confirm_is_called_with_consume_ok_and_adopts_the_broker_tag() {
        List<String> confirmed = new ArrayList<>();
        AmqpQueue queue = new AmqpQueue(channel, "jobs");
        channel.open();
        queue.subscribe(new SubscribeOptions().withAck(true).withConfirm(ok -> confirmed.add(ok.getConsumerTag())),
                DeliveryCallback.payloadOnly(payload -> { }));

        RecordingQueueChannel.Call consume = channel.lastCall("basic.consume");
        assertThat(consume.arg("noWait"), equalTo(false));
        assertThat(consume.arg("autoAck"), equalTo(false));

        consume.reply(new AMQImpl.Basic.ConsumeOk("broker-tag"));

        assertThat(confirmed, contains("broker-tag"));
        assertThat(queue.getConsumerTag(), equalTo("broker-tag"));
    }

    @Test
    public void unsubscribe_no_wait_clears_the_tag_right_away() {
        AmqpQueue queue = new AmqpQueue(channel, "jobs");
        channel.open();
        queue.subscribe(DeliveryCallback.payloadOnly(payload -> { }));
        String tag = queue.getConsumerTag();

        queue.unsubscribe();

        RecordingQueueChannel.Call cancel = channel.lastCall("basic.cancel");
        assertThat(cancel.arg("consumerTag"), equalTo(tag));
        assertThat(cancel.arg("noWait"), equalTo(true));
        assertThat(queue.isSubscribed(), is(false));

        queue.subscribe(DeliveryCallback.payloadOnly(payload -> { }));
        assertThat(channel.calls("basic.consume").size(), equalTo(2));
    }

    @Test
    public void unsubscribe_waiting_for_cancel_ok() {
        List<String> cancelled = new ArrayList<>();
        AmqpQueue queue = new AmqpQueue(channel, "jobs");
        channel.open();
        queue.subscribe(DeliveryCallback.payloadOnly(payload -> { }));
        String tag = queue.getConsumerTag();

        queue.unsubscribe(new UnsubscribeOptions().withNoWait(false), ok -> cancelled.add(ok.getConsumerTag()));
        assertThat(queue.isSubscribed(), is(true));

        channel.lastCall("basic.cancel").reply(new AMQImpl.Basic.CancelOk(tag));

        assertThat(cancelled, contains(tag));
        assertThat(queue.isSubscribed(), is(false));
    }

    @Test
    public void late_consume_ok_of_a_cancelled_consumer_is_ignored() {
        List<String> confirmed = new ArrayList<>();
        AmqpQueue queue = new AmqpQueue(channel, "jobs");
        channel.open();
        SubscribeOptions options = new SubscribeOptions().withConfirm(ok -> confirmed.add(ok.getConsumerTag()));

        queue.subscribe(options, DeliveryCallback.payloadOnly(payload -> { }));
        RecordingQueueChannel.Call first = channel.lastCall("basic.consume");
        String firstTag = (String) first.arg("consumerTag");
        queue.unsubscribe();
        queue.subscribe(options, DeliveryCallback.payloadOnly(payload -> { }));
        RecordingQueueChannel.Call second = channel.lastCall("basic.consume");
        String secondTag = (String) second.arg("consumerTag");

        first.reply(new AMQImpl.Basic.ConsumeOk(firstTag));

        assertThat(queue.getConsumerTag(), equalTo(secondTag));
        assertThat(confirmed, is(empty()));

        second.reply(new AMQImpl.Basic.ConsumeOk(secondTag));
        assertThat(confirmed, contains(secondTag));

        queue.unsubscribe();
        assertThat(channel.lastCall("basic.cancel").arg("consumerTag"), equalTo(secondTag));
        assertThat(queue.isSubscribed(), is(false));
    }

    @Test
    public void changing_bind_options_afterwards_does_not_change_the_binding() {
        AmqpQueue queue = new AmqpQueue(channel, "jobs");
        BindOptions options = new BindOptions().withKey("a");
        queue.bind(new Exchange("logs"), options);
        options.withKey("b");
        channel.open();

        assertThat(channel.lastCall("queue.bind").arg("routingKey"), equalTo("a"));
        assertThat(queue.getBindings().get(new Exchange("logs")).getKey(), equalTo("a"));
    }

    @Test
    public void publish_goes_through_the_default_exchange() {
        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder().messageId("m-1").build();
        AmqpQueue queue = new AmqpQueue(channel, "jobs");
        queue.publish(bytes("job-1"), properties);
        assertThat(channel.calls("basic.publish"), is(empty()));

        channel.open();

        RecordingQueueChannel.Call publish = channel.lastCall("basic.publish");
        assertThat(publish.arg("exchange"), equalTo(""));
        assertThat(publish.arg("routingKey"), equalTo("jobs"));
        assertThat(publish.arg("properties"), equalTo(properties));
        assertThat((byte[]) publish.arg("body"), equalTo(bytes("job-1")));
    }

    @Test
    public void publish_on_server_named_queue_waits_for_the_name() {
        AmqpQueue queue = new AmqpQueue(channel, "");
        queue.publish(bytes("hello"));
        channel.open();
        assertThat(channel.calls("basic.publish"), is(empty()));

        channel.lastCall("queue.declare").reply(new AMQImpl.Queue.DeclareOk("amq.gen-7", 0, 0));

        assertThat(channel.lastCall("basic.publish").arg("routingKey"), equalTo("amq.gen-7"));
        assertThat(channel.lastCall("basic.publish").arg("properties"), is(nullValue()));
    }

    @Test
    public void declare_callback_is_kept() {
        DeclareCallback callback = DeclareCallback.onQueue(q -> { });
        assertThat(new AmqpQueue(channel, "jobs", new QueueOptions(), callback).getDeclareCallback(), equalTo(callback));
        assertThat(new AmqpQueue(channel, "other").getDeclareCallback(), is(nullValue()));
    }

    @Test
    public void unsubscribe_without_consumer_does_nothing() {
        AmqpQueue queue = new AmqpQueue(channel, "jobs");
        channel.open();
        queue.unsubscribe();
        assertThat(channel.calls("basic.cancel"), is(empty()));
    }

    @Test
    public void status_reads_counts_with_a_passive_declare() {
        List<Integer> counts = new ArrayList<>();
        AmqpQueue queue = new AmqpQueue(channel, "jobs");
        channel.open();
        channel.lastCall("queue.declare").reply(new AMQImpl.Queue.DeclareOk("jobs", 0, 0));

        queue.status((messages, consumers) -> {
            counts.add(messages);
            counts.add(consumers);
        });

        RecordingQueueChannel.Call passive = channel.lastCall("queue.declare");
        assertThat(passive.arg("passive"), equalTo(true));
        passive.reply(new AMQImpl.Queue.DeclareOk("jobs", 4, 2));
        assertThat(counts, contains(4, 2));
    }

    @Test
    public void status_needs_a_callback() {
        AmqpQueue queue = new AmqpQueue(channel, "jobs");
        try {
            queue.status(null);
            fail("expected NullPointerException");
        } catch (NullPointerException expected) {
            assertThat(expected.getMessage(), equalTo("status does not make any sense without a callback"));
        }
    }

    @Test
    public void declaration_arguments_are_passed_on() {
        Map<String, Object> arguments = ImmutableMap.<String, Object>of("x-message-ttl", 60_000);
        new AmqpQueue(channel, "jobs", new QueueOptions().withArguments(arguments));
        channel.open();
        assertThat(channel.lastCall("queue.declare").arg("arguments"), equalTo(arguments));
    }

    @Test
    public void options_are_copied_at_construction() {
        QueueOptions options = new QueueOptions();
        AmqpQueue queue = new AmqpQueue(channel, "jobs", options);
        options.withDurable(true);
        assertThat(queue.getOptions().isDurable(), is(false));
        assertThat(options.getNo_wait(), is(nullValue()));
    }

    @Test
    public void reset_redeclares_and_forgets_bindings_and_consumer() {
        List<String> declaredNames = new ArrayList<>();
        AmqpQueue queue = new AmqpQueue(channel, "", new QueueOptions().withExclusive(true),
                DeclareCallback.onQueue(q -> declaredNames.add(q.getName())));
        channel.open();
        channel.lastCall("queue.declare").reply(new AMQImpl.Queue.DeclareOk("amq.gen-1", 0, 0));
        queue.bind("logs");
        queue.subscribe(DeliveryCallback.payloadOnly(payload -> { }));
        assertThat(queue.getBindings().size(), equalTo(1));

        channel.fail();

        assertThat(queue.getName(), equalTo(""));
        assertThat(queue.getStatus(), equalTo(QueueStatus.OPENING));
        assertThat(queue.getBindings().isEmpty(), is(true));
        assertThat(queue.isSubscribed(), is(false));

        channel.open();
        RecordingQueueChannel.Call redeclare = channel.lastCall("queue.declare");
        assertThat(redeclare.arg("queue"), equalTo(""));
        assertThat(redeclare.arg("exclusive"), equalTo(true));
        redeclare.reply(new AMQImpl.Queue.DeclareOk("amq.gen-2", 0, 0));

        assertThat(queue.getName(), equalTo("amq.gen-2"));
        assertThat(declaredNames, contains("amq.gen-1", "amq.gen-2"));
    }

    @Test
    public void replies_from_before_a_reset_are_ignored() {
        AmqpQueue queue = new AmqpQueue(channel, "");
        channel.open();
        RecordingQueueChannel.Call staleDeclare = channel.lastCall("queue.declare");

        queue.reset();
        staleDeclare.reply(new AMQImpl.Queue.DeclareOk("amq.gen-stale", 0, 0));

        assertThat(queue.getName(), equalTo(""));
        assertThat(queue.getStatus(), equalTo(QueueStatus.OPENING));

        channel.lastCall("queue.declare").reply(new AMQImpl.Queue.DeclareOk("amq.gen-fresh", 0, 0));
        assertThat(queue.getName(), equalTo("amq.gen-fresh"));
    }

    @Test
    public void subscription_queued_before_a_reset_is_dropped() {
        AmqpQueue queue = new AmqpQueue(channel, "jobs");
        queue.subscribe(DeliveryCallback.payloadOnly(payload -> { }));

        channel.fail();
        channel.open();

        assertThat(channel.calls("basic.consume"), is(empty()));
        assertThat(queue.isSubscribed(), is(false));
        assertThat(channel.methods(), not(empty()));
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
