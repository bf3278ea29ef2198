package dev.macros.backend;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Transport to locally reachable target devices. Every call is bounded by the
 * timeout it is given.
 */
public interface DeviceShell {

    /**
     * Run a shell command on a device and return its standard output as text.
     *
     * @throws TimeoutException if the command did not finish within {@code timeout}
     * @throws IOException      if the transport failed or the command exited non-zero
     */
    String shell(String deviceId, List<String> command, Duration timeout) throws IOException, TimeoutException;

    /** Like {@link #shell} but returns the raw bytes, for binary output such as screen dumps. */
    byte[] execOut(String deviceId, List<String> command, Duration timeout) throws IOException, TimeoutException;

    /** Ids of the devices currently online. */
    List<String> devices(Duration timeout) throws IOException, TimeoutException;
}
