import com.txscript.script.TxScript;
import com.txscript.script.TxScriptOptions;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TxScriptOptionsTest {

    @Test
    void defaults_are_valid() {
        TxScriptOptions o = new TxScriptOptions();

        assertDoesNotThrow(o::validate);
        assertEquals(64, o.getMaxCallDepth());
        assertEquals(1000, o.getStepBudget());
        assertEquals(64, o.getMaxDataLength());
        assertEquals(List.of(1), o.getDefaultPorts());
    }

    @Test
    void json_binds_known_keys_and_ignores_the_rest() throws Exception {
        TxScriptOptions o = TxScriptOptions.fromJson(
                "{\"maxCallDepth\": 16, \"defaultPorts\": [1, 2], \"maxDataLength\": 8, \"theme\": \"dark\"}");

        assertEquals(16, o.getMaxCallDepth());
        assertEquals(List.of(1, 2), o.getDefaultPorts());
        assertEquals(8, o.getMaxDataLength());
        assertEquals(1000, o.getMaxErrors());
    }

    @Test
    void invalid_values_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> TxScriptOptions.fromJson("{\"stepBudget\": 0}"));
        assertThrows(IllegalArgumentException.class, () -> TxScriptOptions.fromJson("{\"defaultPorts\": []}"));

        TxScriptOptions o = new TxScriptOptions();
        o.setMaxErrors(-1);
        assertThrows(IllegalArgumentException.class, () -> new TxScript(o));
    }

    @Test
    void load_reads_a_file(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("options.json");
        Files.write(file, "{\"stopTimeoutMillis\": 250}".getBytes(StandardCharsets.UTF_8));

        assertEquals(250, TxScriptOptions.load(file).getStopTimeoutMillis());
    }

    @Test
    void max_data_length_limits_send() {
        TxScriptOptions o = new TxScriptOptions();
        o.setMaxDataLength(8);
        ScriptHarness h = new ScriptHarness(o).start(
                "send(0x100, random_bytes(8))",
                "send(0x100, random_bytes(9))");

        assertEquals(1, h.bus.sent.size());
        assertEquals(1, h.runtimeErrors().size());
    }
}
