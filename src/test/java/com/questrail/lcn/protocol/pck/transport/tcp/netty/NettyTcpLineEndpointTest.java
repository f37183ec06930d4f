package com.questrail.lcn.protocol.pck.transport.tcp.netty;

import com.questrail.lcn.protocol.pck.transport.LineEndpointListener;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyTcpLineEndpointTest
 * -----------------------------------------------------------------------------
 * Line framing of {@link NettyTcpLineEndpoint} against a loopback socket.
 */
final class NettyTcpLineEndpointTest
{
    private static final class RecordingListener implements LineEndpointListener
    {
        final CountDownLatch up = new CountDownLatch(1);
        final BlockingQueue<String> lines = new LinkedBlockingQueue<>();
        final AtomicReference<Throwable> down = new AtomicReference<>();

        @Override
        public void onTransportUp()
        {
            up.countDown();
        }

        @Override
        public void onTransportDown(Throwable cause)
        {
            down.set(cause != null ? cause : new IllegalStateException("closed"));
        }

        @Override
        public void onLine(String line)
        {
            lines.add(line);
        }
    }

    @Test
    void overlongAndUndecodableLinesDoNotEndTheSession() throws Exception
    {
        byte[] overlong = ("=M000010.N1" + "x".repeat(1500) + "\r\n").getBytes(StandardCharsets.US_ASCII);
        byte[] windows1250 = {'=', 'M', '0', '0', '0', '0', '1', '0', '.', 'N', '1', (byte) 0xFC, '\r', '\n'};

        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            CountDownLatch hangUp = new CountDownLatch(1);
            CompletableFuture<Void> gateway = CompletableFuture.runAsync(() -> {
                try (Socket socket = server.accept()) {
                    OutputStream out = socket.getOutputStream();
                    out.write(overlong);
                    out.write(windows1250);
                    out.write("$io:#LCN:connected\r\n".getBytes(StandardCharsets.US_ASCII));
                    out.flush();
                    hangUp.await(10, TimeUnit.SECONDS);
                } catch (IOException e) {
                    throw new IllegalStateException(e);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });

            NettyTcpLineEndpoint endpoint = new NettyTcpLineEndpoint(
                    new InetSocketAddress(InetAddress.getLoopbackAddress(), server.getLocalPort()), Duration.ofSeconds(5));
            RecordingListener listener = new RecordingListener();
            endpoint.setListener(listener);
            try {
                endpoint.start();
                assertTrue(listener.up.await(5, TimeUnit.SECONDS));

                assertEquals("=M000010.N1ü", listener.lines.poll(5, TimeUnit.SECONDS));
                assertEquals("$io:#LCN:connected", listener.lines.poll(5, TimeUnit.SECONDS));
                assertNull(listener.down.get());
            } finally {
                endpoint.stop();
                hangUp.countDown();
            }
            gateway.get(10, TimeUnit.SECONDS);
        }
    }

    @Test
    void linesAreSentWithNewline() throws Exception
    {
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            CompletableFuture<String> received = CompletableFuture.supplyAsync(() -> {
                try (Socket socket = server.accept()) {
                    socket.setSoTimeout(5_000);
                    InputStream in = socket.getInputStream();
                    StringBuilder sb = new StringBuilder();
                    int b;
                    while ((b = in.read()) != -1 && b != '\n') {
                        sb.append((char) b);
                    }
                    return sb.toString();
                } catch (IOException e) {
                    throw new IllegalStateException(e);
                }
            });

            NettyTcpLineEndpoint endpoint = new NettyTcpLineEndpoint(
                    new InetSocketAddress(InetAddress.getLoopbackAddress(), server.getLocalPort()), Duration.ofSeconds(5));
            RecordingListener listener = new RecordingListener();
            endpoint.setListener(listener);
            try {
                endpoint.start();
                assertTrue(listener.up.await(5, TimeUnit.SECONDS));
                endpoint.send(">M000010.PIN001");

                assertEquals(">M000010.PIN001", received.get(5, TimeUnit.SECONDS));
            } finally {
                endpoint.stop();
            }
        }
    }
}
