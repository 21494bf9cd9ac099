package me.willkroboth.vmcontrol.actor;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChannelTest {

    @Test
    void receive_ReturnsItemsInOrder() throws Exception {
        Channel<String> channel = Channel.unbounded("test");
        channel.offer("a");
        channel.offer("b");

        assertThat(channel.receive()).isEqualTo("a");
        assertThat(channel.receive()).isEqualTo("b");
    }

    @Test
    void offer_FullChannel_ReturnsFalse() {
        Channel<String> channel = Channel.bounded("test", 2);

        assertThat(channel.offer("a")).isTrue();
        assertThat(channel.offer("b")).isTrue();
        assertThat(channel.offer("c")).isFalse();
        assertThat(channel.size()).isEqualTo(2);
    }

    @Test
    void offer_ClosedChannel_Throws() {
        Channel<String> channel = Channel.bounded("test", 2);
        channel.close();

        assertThatThrownBy(() -> channel.offer("a")).isInstanceOf(ChannelClosedException.class);
    }

    @Test
    void offer_Null_IsRejected() {
        Channel<String> channel = Channel.unbounded("test");

        assertThatThrownBy(() -> channel.offer(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void constructor_NonPositiveCapacity_IsRejected() {
        assertThatThrownBy(() -> Channel.bounded("test", 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void receive_AfterClose_DrainsThenReturnsNull() throws Exception {
        Channel<String> channel = Channel.unbounded("test");
        channel.offer("a");
        channel.close();

        assertThat(channel.receive()).isEqualTo("a");
        assertThat(channel.receive()).isNull();
    }

    @Test
    void close_WakesWaitingReceiver() throws Exception {
        // Given
        Channel<String> channel = Channel.unbounded("test");
        CompletableFuture<String> received = CompletableFuture.supplyAsync(() -> {
            try {
                return channel.receive();
            } catch (InterruptedException exception) {
                throw new IllegalStateException(exception);
            }
        });

        // When
        Thread.sleep(50);
        channel.close();

        // Then
        assertThat(received.get(5, TimeUnit.SECONDS)).isNull();
    }

    @Test
    void receive_WaitsForSender() throws Exception {
        Channel<String> channel = Channel.unbounded("test");
        CompletableFuture<String> received = CompletableFuture.supplyAsync(() -> {
            try {
                return channel.receive();
            } catch (InterruptedException exception) {
                throw new IllegalStateException(exception);
            }
        });

        Thread.sleep(50);
        channel.offer("late");

        assertThat(received.get(5, TimeUnit.SECONDS)).isEqualTo("late");
    }

    @Test
    void poll_NothingSent_TimesOutWithNull() throws Exception {
        Channel<String> channel = Channel.unbounded("test");

        assertThat(channel.poll(Duration.ofMillis(20))).isNull();
        assertThat(channel.isClosed()).isFalse();
    }

    @Test
    void closeAndDiscard_DropsQueuedItems() throws Exception {
        Channel<String> channel = Channel.bounded("test", 10);
        channel.offer("a");
        channel.offer("b");

        assertThat(channel.closeAndDiscard()).isEqualTo(2);
        assertThat(channel.receive()).isNull();
        assertThat(channel.isClosed()).isTrue();
    }
}
