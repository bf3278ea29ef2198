package dev.macros.io;

import dev.macros.model.ButtonType;
import dev.macros.model.Command;
import dev.macros.model.CommandSpec;
import dev.macros.model.ConfigurationException;
import dev.macros.model.OnFail;
import dev.macros.model.Region;
import dev.macros.model.Rgb;
import dev.macros.model.ScanMode;
import dev.macros.model.Script;
import dev.macros.model.WaitMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScriptLoaderTest {

    private static final String FARM_SCRIPT = """
        {
          "version": 1,
          "maxIterations": 500,
          "variablesGlobal": {"rounds": 0, "mode": "fast"},
          "sequence": [
            {"id": "c1", "name": "start", "type": "Click", "x": 540, "y": 960},
            {"id": "c2", "name": "find-button", "type": "CropImage",
             "region": {"x1": 0, "y1": 0, "x2": 1080, "y2": 600},
             "targetColor": "#FF0000", "tolerance": 20, "scanMode": "MaxMatch",
             "onFail": "GotoLabel", "onFailLabel": "start"},
            {"id": "c3", "name": "loop", "type": "Repeat", "count": 3, "until": "rounds > 5",
             "innerCommands": [
               {"id": "c3a", "name": "press", "type": "KeyPress", "key": "enter"}
             ]},
            {"id": "c4", "name": "settle", "type": "Wait", "mode": "PixelColor", "timeoutSec": 1.5,
             "pixelX": 10, "pixelY": 20, "pixelColor": "00FF00"},
            {"id": "c5", "name": "branch", "type": "Condition", "expr": "crop_result != null",
             "nestedThen": [{"id": "c5a", "name": "tap-it", "type": "Click", "x": 1, "y": 2, "button": "Double"}],
             "elseLabel": "start"},
            {"id": "c6", "name": "again", "type": "Goto", "targetLabel": "start", "guard": "rounds < 10",
             "enabled": false, "variablesOut": ["taken"]}
          ],
          "onErrorHandler": {"id": "e1", "name": "recover", "type": "KeyPress", "key": "back"}
        }
        """;

    @Test
    void loadsEveryCommandType() throws Exception {
        Script script = ScriptLoader.loadFromString(FARM_SCRIPT);

        assertThat(script.maxIterations()).isEqualTo(500);
        assertThat(script.variablesGlobal()).containsEntry("rounds", 0).containsEntry("mode", "fast");
        assertThat(script.sequence()).extracting(Command::name)
            .containsExactly("start", "find-button", "loop", "settle", "branch", "again");

        Command crop = script.command("c2");
        assertThat(crop.onFail()).isEqualTo(OnFail.gotoLabel("start"));
        assertThat(crop.spec()).isEqualTo(new CommandSpec.CropImage(new Region(0, 0, 1080, 600),
            new Rgb(255, 0, 0), 20, ScanMode.MAX_MATCH, "crop_result"));

        var wait = (CommandSpec.Wait) script.command("c4").spec();
        assertThat(wait.mode()).isEqualTo(WaitMode.PIXEL_COLOR);
        assertThat(wait.timeout()).isEqualTo(Duration.ofMillis(1500));
        assertThat(wait.pixel().tolerance()).isEqualTo(CommandSpec.PixelProbe.DEFAULT_TOLERANCE);

        assertThat(((CommandSpec.Click) script.command("c5a").spec()).button()).isEqualTo(ButtonType.DOUBLE);
        assertThat(script.command("c6").enabled()).isFalse();
        assertThat(script.command("c6").variablesOut()).containsExactly("taken");
        assertThat(script.onErrorHandler().name()).isEqualTo("recover");
    }

    @Test
    void appliesDefaultsForOptionalFields() throws Exception {
        Script script = ScriptLoader.loadFromString("""
            {"sequence": [{"name": "tap", "type": "Click", "x": 1, "y": 2}]}
            """);

        Command tap = script.sequence().get(0);
        assertThat(tap.id()).isNotBlank();
        assertThat(tap.enabled()).isTrue();
        assertThat(tap.onFail()).isEqualTo(OnFail.SKIP);
        assertThat(tap.spec()).isEqualTo(CommandSpec.Click.at(1, 2));
        assertThat(script.maxIterations()).isEqualTo(Script.DEFAULT_MAX_ITERATIONS);
        assertThat(script.onErrorHandler()).isNull();
    }

    @Test
    void nestedCommandsInheritTheirParentId() throws Exception {
        Script script = ScriptLoader.loadFromString(FARM_SCRIPT);

        assertThat(script.command("c3a").parentId()).isEqualTo("c3");
        assertThat(script.command("c5a").parentId()).isEqualTo("c5");
        assertThat(script.command("c1").parentId()).isNull();
    }

    @Test
    void rejectsNewerFormatVersions() {
        assertThatThrownBy(() -> ScriptLoader.loadFromString("{\"version\": 2, \"sequence\": []}"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Unsupported script version 2");
    }

    @Test
    void errorsNameTheOffendingCommand() {
        assertThatThrownBy(() -> ScriptLoader.loadFromString("""
            {"sequence": [
              {"name": "ok", "type": "Click", "x": 1, "y": 1},
              {"name": "bad", "type": "CropImage", "region": {"x1": 0, "y1": 0, "x2": 5, "y2": 5},
               "targetColor": "#000000", "tolerance": 300}
            ]}
            """))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageStartingWith("sequence[1] 'bad': ")
            .hasMessageContaining("tolerance");
    }

    @Test
    void rejectsUnknownTypesAndMissingFields() {
        assertThatThrownBy(() -> ScriptLoader.loadFromString(
            "{\"sequence\": [{\"name\": \"x\", \"type\": \"Swipe\"}]}"))
            .hasMessageContaining("Unknown command type 'Swipe'");
        assertThatThrownBy(() -> ScriptLoader.loadFromString(
            "{\"sequence\": [{\"name\": \"x\", \"type\": \"Click\", \"x\": 1}]}"))
            .hasMessageContaining("missing required field 'y'");
    }

    @Test
    void rejectsTextWhereANumberBelongs() {
        assertThatThrownBy(() -> ScriptLoader.loadFromString("""
            {"sequence": [{"name": "find", "type": "CropImage", "region": {"x1": 0, "y1": 0, "x2": 5, "y2": 5},
              "targetColor": "#000000", "tolerance": "very loose"}]}
            """))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("field 'tolerance' must be an integer");
        assertThatThrownBy(() -> ScriptLoader.loadFromString("""
            {"sequence": [{"name": "settle", "type": "Wait", "mode": "ScreenChange", "screenThreshold": "high"}]}
            """))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("field 'screenThreshold' must be a number");
    }

    @Test
    void rejectsFractionsAndOverflowInIntegerFields() {
        assertThatThrownBy(() -> ScriptLoader.loadFromString(
            "{\"sequence\": [{\"name\": \"t\", \"type\": \"Click\", \"x\": 1.5, \"y\": 1}]}"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("field 'x' must be an integer");
        assertThatThrownBy(() -> ScriptLoader.loadFromString(
            "{\"maxIterations\": 4294967296, \"sequence\": []}"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("field 'maxIterations' must be an integer");
    }

    @Test
    void rejectsUnresolvedLabelsAtLoad() {
        assertThatThrownBy(() -> ScriptLoader.loadFromString(
            "{\"sequence\": [{\"name\": \"g\", \"type\": \"Goto\", \"targetLabel\": \"nowhere\"}]}"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("not found");
    }

    @Test
    void writerEmitsTheCurrentFormatVersionWithDefaults() throws Exception {
        Script script = ScriptLoader.loadFromString("""
            {"sequence": [{"id": "t1", "name": "tap", "type": "Click", "x": 1, "y": 2}]}
            """);

        String json = ScriptWriter.writeToString(script);

        assertThat(json)
            .contains("\"version\" : 1")
            .contains("\"button\" : \"Left\"")
            .contains("\"humanizeDelayMin\" : 50")
            .contains("\"onErrorHandler\" : null");
        assertThat(ScriptLoader.loadFromString(json).sequence()).isEqualTo(script.sequence());
    }

    @Test
    void savedScriptReloadsToTheSameCommands(@TempDir Path dir) throws Exception {
        Script original = ScriptLoader.loadFromString(FARM_SCRIPT);
        original.setEnabled("c1", false);
        Path file = dir.resolve("farm.json");

        ScriptWriter.writeToFile(original, file);
        Script reloaded = ScriptLoader.loadFromFile(file);

        assertThat(reloaded.sequence()).isEqualTo(original.effectiveSequence());
        assertThat(reloaded.command("c1").enabled()).isFalse();
        assertThat(reloaded.variablesGlobal()).isEqualTo(original.variablesGlobal());
        assertThat(reloaded.maxIterations()).isEqualTo(500);
        assertThat(reloaded.onErrorHandler()).isEqualTo(original.onErrorHandler());
    }
}
