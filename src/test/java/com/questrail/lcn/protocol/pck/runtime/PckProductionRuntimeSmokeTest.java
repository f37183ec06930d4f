package com.questrail.lcn.protocol.pck.runtime;

import com.questrail.lcn.protocol.pck.PckConnectionState;
import com.questrail.lcn.protocol.pck.config.PckConnectionConfig;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Full stack against a scripted gateway on a loopback socket.
 */
class PckProductionRuntimeSmokeTest
{
    @Test
    void connectsThroughLoginAndSegmentScan() throws Exception
    {
        List<String> received = new CopyOnWriteArrayList<>();
        CountDownLatch hangUp = new CountDownLatch(1);

        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            CompletableFuture<Void> gateway = CompletableFuture.runAsync(() -> playGateway(server, received, hangUp));

            PckConnectionConfig config = PckConnectionConfig.builder()
                    .withHost("127.0.0.1")
                    .withPort(server.getLocalPort())
                    .withUsername("lcn")
                    .withPassword("lcn")
                    .withConnectTimeout(Duration.ofSeconds(5))
                    .build();

            PckProductionRuntime runtime = PckProductionRuntime.builder()
                    .withConfig(config)
                    .build();
            try {
                runtime.start().get(10, TimeUnit.SECONDS);

                assertEquals(PckConnectionState.READY, runtime.connection().state());
                assertEquals(7, runtime.connection().localSegmentId());
                assertEquals(List.of("lcn", "lcn", "!CHD", "!OM0P"), received.subList(0, 4));
            } finally {
                runtime.stop();
                hangUp.countDown();
            }
            gateway.get(10, TimeUnit.SECONDS);
            assertEquals(PckConnectionState.DISCONNECTED, runtime.connection().state());
        }
    }

    private static void playGateway(ServerSocket server, List<String> received, CountDownLatch hangUp)
    {
        try (Socket socket = server.accept()) {
            socket.setSoTimeout(10_000);
            BufferedReader in = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            OutputStream out = socket.getOutputStream();

            write(out, "LCN-PCK/IP 1.0");
            write(out, "Username:");
            received.add(in.readLine());
            write(out, "Password:");
            received.add(in.readLine());
            write(out, "OK");
            received.add(in.readLine());
            write(out, "(dec-mode)");
            received.add(in.readLine());
            write(out, "$io:#LCN:connected");

            String line;
            while ((line = in.readLine()) != null) {
                received.add(line);
                if (line.equals(">G003003.SK")) {
                    write(out, "=M000010.SK007");
                    break;
                }
            }
            hangUp.await(10, TimeUnit.SECONDS);
        } catch (IOException e) {
            throw new IllegalStateException("Gateway script failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void write(OutputStream out, String line) throws IOException
    {
        out.write((line + "\r\n").getBytes(StandardCharsets.UTF_8));
        out.flush();
    }
}
