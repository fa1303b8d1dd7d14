package com.p14n.kafkatopology.client;

import com.p14n.kafkatopology.data.SaslMechanism;
import com.p14n.kafkatopology.data.SecurityProtocol;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory {@link BrokerClient} recording every call in order, e.g.
 * {@code open}, {@code topic:orders}, {@code send:orders},
 * {@code flush}, {@code destroy:orders}, {@code close}.
 */
public class RecordingBrokerClient implements BrokerClient {

    public final List<String> calls = new CopyOnWriteArrayList<>();
    public final List<RecordingConfig> configs = new CopyOnWriteArrayList<>();
    public final List<Long> opaques = new CopyOnWriteArrayList<>();

    private String openFailure;
    private final Set<String> failingTopics = new HashSet<>();
    private String sendFailure;
    private FlushResult flushResult = FlushResult.ok();
    private boolean deliverOnSend = true;

    private int opened;
    private int closed;
    private int topicHandles;
    private int destroyedHandles;

    public RecordingBrokerClient failOpen(String cause) {
        this.openFailure = cause;
        return this;
    }

    public RecordingBrokerClient failTopic(String topic) {
        failingTopics.add(topic);
        return this;
    }

    public RecordingBrokerClient failSend(String cause) {
        this.sendFailure = cause;
        return this;
    }

    public RecordingBrokerClient flushWith(FlushResult result) {
        this.flushResult = result;
        return this;
    }

    public RecordingBrokerClient deliverOnSend(boolean deliver) {
        this.deliverOnSend = deliver;
        return this;
    }

    public synchronized int opened() {
        return opened;
    }

    public synchronized int closed() {
        return closed;
    }

    public synchronized int topicHandles() {
        return topicHandles;
    }

    public synchronized int destroyedHandles() {
        return destroyedHandles;
    }

    public long count(String call) {
        return calls.stream().filter(call::equals).count();
    }

    public long releasedConfigs() {
        return configs.stream().filter(c -> c.released).count();
    }

    @Override
    public String version() {
        return "test-1.0";
    }

    @Override
    public BrokerConfig newConfig() {
        RecordingConfig config = new RecordingConfig();
        configs.add(config);
        return config;
    }

    @Override
    public synchronized ProducerHandle open(BrokerConfig config) throws BrokerClientException {
        calls.add("open");
        if (openFailure != null) {
            throw new BrokerClientException(openFailure);
        }
        opened++;
        return new Handle((RecordingConfig) config);
    }

    @Override
    public synchronized void close(ProducerHandle handle) {
        calls.add("close");
        ((Handle) handle).closed = true;
        closed++;
    }

    @Override
    public synchronized TopicHandle createTopicHandle(ProducerHandle handle, String topicName, long opaque)
            throws BrokerClientException {
        calls.add("topic:" + topicName);
        if (failingTopics.contains(topicName)) {
            throw new BrokerClientException("Invalid topic " + topicName);
        }
        opaques.add(opaque);
        topicHandles++;
        return new Topic((Handle) handle, topicName, opaque);
    }

    @Override
    public void send(TopicHandle topic, byte[] payload) throws BrokerClientException {
        Topic t = (Topic) topic;
        calls.add("send:" + t.name);
        if (sendFailure != null) {
            throw new BrokerClientException(sendFailure);
        }
        DeliveryCallback callback = t.handle.config.callback;
        if (deliverOnSend && callback != null) {
            callback.onDelivery(t.opaque, DeliveryReport.delivered(t.name, 0, 0L));
        }
    }

    @Override
    public FlushResult flush(ProducerHandle handle, Duration timeout) {
        calls.add("flush");
        return flushResult;
    }

    @Override
    public synchronized void destroyTopicHandle(TopicHandle topic) {
        calls.add("destroy:" + topic.topicName());
        destroyedHandles++;
    }

    public static class RecordingConfig implements BrokerConfig {
        public final Map<ConfigProperty, String> settings = new EnumMap<>(ConfigProperty.class);
        public final List<ConfigProperty> order = new ArrayList<>();
        public DeliveryCallback callback;
        public boolean released;

        @Override
        public void set(ConfigProperty property, String value) throws ConfigRejectedException {
            order.add(property);
            if (property == ConfigProperty.SECURITY_PROTOCOL && SecurityProtocol.parse(value).isEmpty()) {
                throw new ConfigRejectedException(property, "Invalid value \"" + value
                        + "\" for configuration property \"security.protocol\"");
            }
            if (property == ConfigProperty.SASL_MECHANISM && SaslMechanism.parse(value).isEmpty()) {
                throw new ConfigRejectedException(property, "Unsupported SASL mechanism " + value);
            }
            settings.put(property, value);
        }

        @Override
        public void onDelivery(DeliveryCallback callback) {
            this.callback = callback;
        }

        @Override
        public void release() {
            released = true;
        }
    }

    static class Handle implements ProducerHandle {
        final RecordingConfig config;
        boolean closed;

        Handle(RecordingConfig config) {
            this.config = config;
        }
    }

    static class Topic implements TopicHandle {
        final Handle handle;
        final String name;
        final long opaque;

        Topic(Handle handle, String name, long opaque) {
            this.handle = handle;
            this.name = name;
            this.opaque = opaque;
        }

        @Override
        public String topicName() {
            return name;
        }

        @Override
        public long opaque() {
            return opaque;
        }
    }
}
