package dev.macros.device;

import dev.macros.backend.FakeDeviceShell;
import dev.macros.coords.Resolution;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class DeviceResolutionServiceTest {

    private static final String DEVICE = "emulator-5554";

    private final FakeDeviceShell shell = new FakeDeviceShell();
    private final DeviceResolutionService service = DeviceResolutionService.withDefaultProbes(shell);

    @Test
    void primaryProbeAnswers() {
        shell.reply("wm size", "Physical size: 1080x1920\n");

        ResolutionResult result = service.queryResolution(DEVICE);

        assertThat(result).isEqualTo(new ResolutionResult.Resolved(new Resolution(1080, 1920), "wm size"));
        assertThat(shell.commands(DEVICE, "dumpsys")).isEmpty();
    }

    @Test
    void fallsBackToDisplayDumpWhenPrimaryTimesOut() {
        shell.timeoutOn("wm size")
            .reply("dumpsys display", "mBaseDisplayInfo=DisplayInfo{\"Built-in\", real 720 x 1280, density 320}");

        ResolutionResult result = service.queryResolution(DEVICE, Duration.ofMillis(50));

        assertThat(result.toOptional()).contains(new Resolution(720, 1280));
        assertThat(((ResolutionResult.Resolved) result).source()).isEqualTo("dumpsys display");
    }

    @Test
    void reportsEveryTierWhenAllFail() {
        shell.timeoutOn("wm size").reply("dumpsys display", "nothing useful");

        ResolutionResult result = service.queryResolution(DEVICE, Duration.ofMillis(50));

        assertThat(result).isInstanceOf(ResolutionResult.Unresolved.class);
        var unresolved = (ResolutionResult.Unresolved) result;
        assertThat(unresolved.timedOut()).isTrue();
        assertThat(unresolved.failures()).extracting(ProbeFailure::reason)
            .containsExactly(ProbeFailure.Reason.TIMEOUT, ProbeFailure.Reason.UNPARSEABLE);
        assertThat(service.cached(DEVICE)).isEmpty();
    }

    @Test
    void transportErrorsAreNotTimeouts() {
        shell.failOn("wm size").failOn("dumpsys display");

        var result = (ResolutionResult.Unresolved) service.queryResolution(DEVICE);

        assertThat(result.timedOut()).isFalse();
        assertThat(result.failures()).extracting(ProbeFailure::reason)
            .containsOnly(ProbeFailure.Reason.TRANSPORT);
    }

    @Test
    void malformedIdDoesNoIo() {
        ResolutionResult result = service.queryResolution("emu; rm -rf /");

        assertThat(result).isInstanceOf(ResolutionResult.Unresolved.class);
        assertThat(((ResolutionResult.Unresolved) result).failures().get(0).reason())
            .isEqualTo(ProbeFailure.Reason.INVALID_ID);
        assertThat(shell.calls()).isEmpty();
    }

    @Test
    void cachesResolvedSizesUntilInvalidated() {
        shell.reply("wm size", "Physical size: 1080x1920");

        service.queryResolution(DEVICE);
        ResolutionResult second = service.queryResolution(DEVICE);

        assertThat(((ResolutionResult.Resolved) second).source()).isEqualTo("cache");
        assertThat(shell.commands(DEVICE, "wm size")).hasSize(1);

        service.invalidate(DEVICE);
        service.queryResolution(DEVICE);
        assertThat(shell.commands(DEVICE, "wm size")).hasSize(2);
    }

    @Test
    void acceptsNetworkAddressIds() {
        assertThat(DeviceIds.isValid("127.0.0.1:21503")).isTrue();
        assertThat(DeviceIds.isValid("emulator-5554")).isTrue();
        assertThat(DeviceIds.isValid("")).isFalse();
        assertThat(DeviceIds.isValid("a b")).isFalse();
        assertThat(DeviceIds.isValid(null)).isFalse();
    }
}
