package dev.macros.backend;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Scripted {@link DeviceShell}: replies are keyed by the space-joined command
 * ("wm size"); unknown commands succeed with empty output. Every call is recorded.
 */
public final class FakeDeviceShell implements DeviceShell {

    @FunctionalInterface
    public interface Reply {
        String reply(String deviceId) throws IOException, TimeoutException;
    }

    @FunctionalInterface
    public interface BinaryReply {
        byte[] reply(String deviceId) throws IOException, TimeoutException;
    }

    public record Call(String deviceId, String command) {}

    private final Map<String, Reply> replies = new HashMap<>();
    private final Map<String, BinaryReply> binaryReplies = new HashMap<>();
    private final List<Call> calls = new ArrayList<>();
    private List<String> devices = List.of();

    public FakeDeviceShell reply(String command, String output) {
        replies.put(command, id -> output);
        return this;
    }

    public FakeDeviceShell reply(String command, Reply reply) {
        replies.put(command, reply);
        return this;
    }

    public FakeDeviceShell replyBinary(String command, BinaryReply reply) {
        binaryReplies.put(command, reply);
        return this;
    }

    public FakeDeviceShell timeoutOn(String command) {
        return reply(command, id -> {
            throw new TimeoutException(command + " timed out");
        });
    }

    public FakeDeviceShell failOn(String command) {
        return reply(command, id -> {
            throw new IOException(command + " failed");
        });
    }

    public FakeDeviceShell devices(String... ids) {
        this.devices = List.of(ids);
        return this;
    }

    public synchronized List<Call> calls() {
        return List.copyOf(calls);
    }

    /** Recorded commands starting with {@code prefix}, for one device. */
    public synchronized List<String> commands(String deviceId, String prefix) {
        return calls.stream()
            .filter(c -> c.deviceId().equals(deviceId) && c.command().startsWith(prefix))
            .map(Call::command)
            .toList();
    }

    @Override
    public String shell(String deviceId, List<String> command, Duration timeout) throws IOException, TimeoutException {
        String key = String.join(" ", command);
        record(deviceId, key);
        Reply reply = replies.get(key);
        return reply == null ? "" : reply.reply(deviceId);
    }

    @Override
    public byte[] execOut(String deviceId, List<String> command, Duration timeout) throws IOException, TimeoutException {
        String key = String.join(" ", command);
        record(deviceId, key);
        BinaryReply reply = binaryReplies.get(key);
        if (reply == null) {
            throw new IOException("no binary reply for " + key);
        }
        return reply.reply(deviceId);
    }

    @Override
    public List<String> devices(Duration timeout) {
        return devices;
    }

    private synchronized void record(String deviceId, String command) {
        calls.add(new Call(deviceId, command));
    }
}
