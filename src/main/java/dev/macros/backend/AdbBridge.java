package dev.macros.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link DeviceShell} backed by the {@code adb} executable. Each call starts one
 * {@code adb} process; stdout and stderr are drained on background threads while the
 * caller waits at most the given timeout, after which the process is killed.
 */
public final class AdbBridge implements DeviceShell {

    private static final Logger log = LoggerFactory.getLogger(AdbBridge.class);

    private static final File NULL_FILE = new File(
        System.getProperty("os.name", "").toLowerCase().contains("win") ? "NUL" : "/dev/null");

    private final String adbPath;

    public AdbBridge(String adbPath) {
        if (adbPath == null || adbPath.isBlank()) {
            throw new IllegalArgumentException("adb path must not be blank");
        }
        this.adbPath = adbPath;
    }

    public String adbPath() {
        return adbPath;
    }

    @Override
    public String shell(String deviceId, List<String> command, Duration timeout) throws IOException, TimeoutException {
        return new String(run(deviceArgs(deviceId, "shell", command), timeout), StandardCharsets.UTF_8);
    }

    @Override
    public byte[] execOut(String deviceId, List<String> command, Duration timeout) throws IOException, TimeoutException {
        return run(deviceArgs(deviceId, "exec-out", command), timeout);
    }

    @Override
    public List<String> devices(Duration timeout) throws IOException, TimeoutException {
        String output = new String(run(List.of("devices"), timeout), StandardCharsets.UTF_8);
        return parseDevices(output);
    }

    /** Ids of the {@code device}-state entries in {@code adb devices} output. */
    static List<String> parseDevices(String output) {
        var ids = new ArrayList<String>();
        for (String line : output.split("\\R")) {
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("List of devices") || trimmed.startsWith("*")) {
                continue;
            }
            String[] parts = trimmed.split("\\s+");
            if (parts.length >= 2 && parts[1].equals("device")) {
                ids.add(parts[0]);
            }
        }
        return ids;
    }

    private List<String> deviceArgs(String deviceId, String verb, List<String> command) {
        var args = new ArrayList<String>(command.size() + 3);
        args.add("-s");
        args.add(deviceId);
        args.add(verb);
        args.addAll(command);
        return args;
    }

    private byte[] run(List<String> args, Duration timeout) throws IOException, TimeoutException {
        var command = new ArrayList<String>(args.size() + 1);
        command.add(adbPath);
        command.addAll(args);

        var pb = new ProcessBuilder(command);
        pb.redirectInput(ProcessBuilder.Redirect.from(NULL_FILE));
        log.debug("Running {}", command);
        Process process = pb.start();

        CompletableFuture<byte[]> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
        CompletableFuture<byte[]> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new TimeoutException("%s did not complete within %d ms".formatted(args, timeout.toMillis()));
            }
            byte[] out = stdout.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (process.exitValue() != 0) {
                String err = new String(stderr.get(timeout.toMillis(), TimeUnit.MILLISECONDS), StandardCharsets.UTF_8).strip();
                throw new IOException("%s exited with %d: %s".formatted(args, process.exitValue(), err));
            }
            return out;
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while running " + args, e);
        } catch (ExecutionException e) {
            throw new IOException("Failed reading output of " + args, e.getCause());
        }
    }

    private static byte[] drain(InputStream in) {
        try (in) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public String toString() {
        return "AdbBridge[" + adbPath + "]";
    }
}
