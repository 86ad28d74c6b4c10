/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.transport;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.macstab.oss.ringdriver.error.ConnectionException;
import com.macstab.oss.ringdriver.error.RequestTimeoutException;
import com.macstab.oss.ringdriver.protocol.Frame;
import com.macstab.oss.ringdriver.protocol.OptionsRequest;
import com.macstab.oss.ringdriver.protocol.ProtocolEvent;
import com.macstab.oss.ringdriver.protocol.ProtocolVersion;
import com.macstab.oss.ringdriver.protocol.StatusChangeEvent;
import com.macstab.oss.ringdriver.protocol.VoidResult;

import io.netty.channel.embedded.EmbeddedChannel;

/**
 * Tests for {@link NettyFrameTransport}.
 *
 * <p><strong>Test Strategy:</strong>
 *
 * <ul>
 *   <li>{@link EmbeddedChannel} without codec: outbound and inbound messages are {@link Frame}s
 *   <li>Stream id correlation, late responses, push events and close
 * </ul>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("NettyFrameTransport")
class NettyFrameTransportTest {

  private static final InetSocketAddress REMOTE = new InetSocketAddress("10.0.0.1", 9042);
  private static final Duration TIMEOUT = Duration.ofSeconds(30);

  private final List<ProtocolEvent> events = new CopyOnWriteArrayList<>();
  private EmbeddedChannel channel;
  private NettyFrameTransport transport;

  @BeforeEach
  void setUp() {
    channel = new EmbeddedChannel();
    transport = new NettyFrameTransport(channel, ProtocolVersion.V4, REMOTE, events::add);
    channel.pipeline().addLast(transport.handler());
  }

  @AfterEach
  void tearDown() {
    channel.finishAndReleaseAll();
  }

  private Frame sentFrame() {
    final Frame frame = channel.readOutbound();
    assertThat(frame).isNotNull();
    return frame;
  }

  @Test
  @DisplayName("completes a request with the response on its stream id")
  void send_Response_CompletesFuture() {
    // Arrange
    final var future = transport.send(OptionsRequest.INSTANCE, TIMEOUT);
    final var request = sentFrame();

    // Act
    channel.writeInbound(
        new Frame(ProtocolVersion.V4, 0, request.streamId(), VoidResult.INSTANCE));

    // Assert
    assertThat(future).isCompletedWithValue(VoidResult.INSTANCE);
    assertThat(transport.inFlight()).isZero();
  }

  @Test
  @DisplayName("concurrent requests use distinct stream ids")
  void send_TwoRequests_DistinctStreams() {
    // Act
    final var first = transport.send(OptionsRequest.INSTANCE, TIMEOUT);
    final var second = transport.send(OptionsRequest.INSTANCE, TIMEOUT);

    // Assert
    final var firstFrame = sentFrame();
    final var secondFrame = sentFrame();
    assertThat(firstFrame.streamId()).isNotEqualTo(secondFrame.streamId());
    assertThat(transport.inFlight()).isEqualTo(2);

    channel.writeInbound(
        new Frame(ProtocolVersion.V4, 0, secondFrame.streamId(), VoidResult.INSTANCE));
    assertThat(second).isCompleted();
    assertThat(first).isNotDone();
  }

  @Test
  @DisplayName("a timed-out request keeps its stream id until the late response")
  void send_Timeout_IdHeldUntilLateResponse() {
    // Arrange
    final var future = transport.send(OptionsRequest.INSTANCE, Duration.ZERO);
    final var request = sentFrame();

    // Act
    channel.runScheduledPendingTasks();

    // Assert
    assertThat(future)
        .isCompletedExceptionally()
        .failsWithin(Duration.ZERO)
        .withThrowableOfType(Exception.class)
        .withCauseInstanceOf(RequestTimeoutException.class);
    assertThat(transport.inFlight()).isEqualTo(1);

    channel.writeInbound(
        new Frame(ProtocolVersion.V4, 0, request.streamId(), VoidResult.INSTANCE));
    assertThat(transport.inFlight()).isZero();
  }

  @Test
  @DisplayName("server pushes go to the event listener")
  void channelRead_Event_Delivered() {
    // Arrange
    final var event = new StatusChangeEvent(StatusChangeEvent.Status.DOWN, REMOTE);

    // Act
    channel.writeInbound(new Frame(ProtocolVersion.V4, 0, -1, event));

    // Assert
    assertThat(events).containsExactly(event);
  }

  @Test
  @DisplayName("closing fails pending requests and rejects new ones")
  void close_PendingRequests_Failed() {
    // Arrange
    final var pending = transport.send(OptionsRequest.INSTANCE, TIMEOUT);

    // Act
    transport.close();

    // Assert
    assertThat(transport.closeFuture()).isDone();
    assertThat(transport.isOpen()).isFalse();
    assertThat(pending).isCompletedExceptionally();
    assertThat(pending.handle((r, e) -> e).join()).isInstanceOf(ConnectionException.class);
    assertThat(transport.inFlight()).isZero();
    assertThat(transport.send(OptionsRequest.INSTANCE, TIMEOUT))
        .failsWithin(Duration.ZERO)
        .withThrowableOfType(Exception.class)
        .withCauseInstanceOf(ConnectionException.class);
  }
}
