/*
 * Copyright (c) 2023 VMware Inc. or its affiliates, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package reactor.kstream.processor;

import org.apache.kafka.clients.consumer.RetriableCommitFailedException;
import org.apache.kafka.common.errors.RebalanceInProgressException;
import org.junit.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.Assert.assertEquals;

public class ImmutableStreamOptionsTest {

    @Test
    public void defaults() {
        StreamOptions options = StreamOptions.create();

        assertThat(options.streamId()).startsWith("reactor-kstream-");
        assertThat(options.commitInterval()).isEqualTo(Duration.ofSeconds(5));
        assertThat(options.commitBatchSize()).isZero();
        assertThat(options.ackMode()).isEqualTo(AckMode.AUTO_ACK);
        assertThat(options.bufferSize()).isEqualTo(100);
        assertThat(options.bufferWindow()).isEqualTo(Duration.ofSeconds(1));
        assertThat(options.maxBufferSize()).isEqualTo(10_000);
        assertThat(options.commitRetryBackoff()).isEqualTo(Duration.ofMillis(100));
        assertThat(options.maxCommitRetryBackoff()).isEqualTo(Duration.ofSeconds(10));
        assertThat(options.closeTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(options.listeners()).isEmpty();
    }

    @Test
    public void streamIdsAreUnique() {
        assertThat(StreamOptions.create().streamId()).isNotEqualTo(StreamOptions.create().streamId());
    }

    @Test
    public void withersReturnNewInstances() {
        StreamOptions options = StreamOptions.create().streamId("orders");
        StreamOptions changed = options.bufferSize(10);

        assertThat(changed).isNotSameAs(options);
        assertThat(options.bufferSize()).isEqualTo(100);
        assertThat(changed.bufferSize()).isEqualTo(10);
        assertThat(changed.streamId()).isEqualTo("orders");
    }

    @Test
    public void createFromProperties() {
        Properties properties = new Properties();
        properties.setProperty(StreamOptions.STREAM_ID_CONFIG, "orders");
        properties.setProperty(StreamOptions.COMMIT_INTERVAL_MS_CONFIG, "250");
        properties.setProperty(StreamOptions.COMMIT_BATCH_SIZE_CONFIG, "50");
        properties.setProperty(StreamOptions.ACK_MODE_CONFIG, "noack");
        properties.setProperty(StreamOptions.BUFFER_SIZE_CONFIG, "20");
        properties.setProperty(StreamOptions.BUFFER_WINDOW_MS_CONFIG, "500");
        properties.setProperty(StreamOptions.BUFFER_MAX_SIZE_CONFIG, "30");
        properties.setProperty(StreamOptions.COMMIT_RETRY_BACKOFF_MS_CONFIG, "10");
        properties.setProperty(StreamOptions.COMMIT_RETRY_BACKOFF_MAX_MS_CONFIG, "1000");
        properties.setProperty(StreamOptions.CLOSE_TIMEOUT_MS_CONFIG, "0");

        StreamOptions options = StreamOptions.create(properties);

        assertThat(options.streamId()).isEqualTo("orders");
        assertThat(options.commitInterval()).isEqualTo(Duration.ofMillis(250));
        assertThat(options.commitBatchSize()).isEqualTo(50);
        assertThat(options.ackMode()).isEqualTo(AckMode.MANUAL_ACK);
        assertThat(options.bufferSize()).isEqualTo(20);
        assertThat(options.bufferWindow()).isEqualTo(Duration.ofMillis(500));
        assertThat(options.maxBufferSize()).isEqualTo(30);
        assertThat(options.commitRetryBackoff()).isEqualTo(Duration.ofMillis(10));
        assertThat(options.maxCommitRetryBackoff()).isEqualTo(Duration.ofSeconds(1));
        assertThat(options.closeTimeout()).isEqualTo(Duration.ZERO);
    }

    @Test
    public void propertiesAndMapProduceEqualOptions() {
        Properties properties = new Properties();
        properties.setProperty(StreamOptions.STREAM_ID_CONFIG, "orders");
        properties.setProperty(StreamOptions.BUFFER_SIZE_CONFIG, "20");
        Map<String, Object> map = new HashMap<>();
        map.put(StreamOptions.STREAM_ID_CONFIG, "orders");
        map.put(StreamOptions.BUFFER_SIZE_CONFIG, 20);

        assertEquals(StreamOptions.create(properties), StreamOptions.create(map));
        assertEquals(StreamOptions.create(map).hashCode(), StreamOptions.create(properties).hashCode());
    }

    @Test
    public void unknownPropertyIsRejected() {
        Map<String, Object> map = new HashMap<>();
        map.put("buffer.sise", 20);
        assertThatThrownBy(() -> StreamOptions.create(map))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("buffer.sise");
    }

    @Test
    public void invalidValuesAreRejected() {
        StreamOptions options = StreamOptions.create();

        assertThatThrownBy(() -> options.bufferSize(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> options.bufferSize(10_001)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> options.commitBatchSize(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> options.commitInterval(Duration.ofMillis(-1))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> options.bufferWindow(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> options.maxBufferSize(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> options.streamId("")).isInstanceOf(IllegalArgumentException.class);

        Map<String, Object> map = new HashMap<>();
        map.put(StreamOptions.ACK_MODE_CONFIG, "sometimes");
        assertThatThrownBy(() -> StreamOptions.create(map)).isInstanceOf(IllegalArgumentException.class);
        map.put(StreamOptions.ACK_MODE_CONFIG, "auto");
        map.put(StreamOptions.COMMIT_INTERVAL_MS_CONFIG, "soon");
        assertThatThrownBy(() -> StreamOptions.create(map)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void loweringTheBufferCeilingLowersTheBufferSize() {
        StreamOptions options = StreamOptions.create().maxBufferSize(10);

        assertThat(options.maxBufferSize()).isEqualTo(10);
        assertThat(options.bufferSize()).isEqualTo(10);
        assertThat(options.maxBufferSize(50).bufferSize()).isEqualTo(10);
    }

    @Test
    public void listeners() {
        StreamListener first = new StreamListener() { };
        StreamListener second = new StreamListener() { };
        StreamOptions options = StreamOptions.create().addListener(first).addListener(second);

        assertThat(options.listeners()).containsExactly(first, second);
        assertThatThrownBy(() -> options.listeners().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThat(options.clearListeners().listeners()).isEmpty();
    }

    @Test
    public void defaultRetriableCommitExceptions() {
        StreamOptions options = StreamOptions.create();

        assertThat(options.retriableCommitException().test(new RetriableCommitFailedException("test"))).isTrue();
        assertThat(options.retriableCommitException().test(new RebalanceInProgressException("test"))).isTrue();
        assertThat(options.retriableCommitException().test(new IllegalStateException("test"))).isFalse();
        assertThat(options.retriableCommitException(e -> true).retriableCommitException()
            .test(new IllegalStateException("test"))).isTrue();
    }
}
