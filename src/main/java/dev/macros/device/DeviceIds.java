package dev.macros.device;

import java.util.regex.Pattern;

/**
 * Format check for device ids ({@code emulator-5554}, {@code 127.0.0.1:21503},
 * hardware serials) before they reach a process command line.
 */
public final class DeviceIds {

    private static final Pattern VALID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,63}(:\\d{1,5})?");

    private DeviceIds() {}

    public static boolean isValid(String deviceId) {
        return deviceId != null && VALID.matcher(deviceId).matches();
    }
}
