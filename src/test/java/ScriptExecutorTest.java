import com.txscript.script.TxScriptOptions;
import com.txscript.script.error.ErrorKind;
import com.txscript.script.error.ErrorPhase;
import com.txscript.script.error.ScriptError;
import com.txscript.script.runtime.ExecutionSnapshot;
import com.txscript.script.runtime.ExecutionState;
import com.txscript.script.runtime.ScriptLogEntry;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ScriptExecutorTest {

    @Test
    void repeat_sends_exactly_n_frames() {
        ScriptHarness h = new ScriptHarness().start("repeat(3) { send(0x1, 0x01) }");

        assertEquals(3, h.bus.sent.size());
        for (RecordingCanBus.Sent s : h.bus.sent) {
            assertEquals(1, s.port);
            assertEquals(0x1, s.id);
            assertArrayEquals(new byte[] { 0x01 }, s.data);
            assertFalse(s.extended);
        }
        assertEquals(ExecutionState.STOPPED, h.executor.getState());
        assertEquals(3, h.executor.snapshot().getFramesSent());
    }

    @Test
    void loop_with_break_ends_with_expected_value() {
        ScriptHarness h = new ScriptHarness().start(
                "var x = 0",
                "loop { if (x > 10) { break } x = x + 1 }");

        assertEquals(11, h.intGlobal("x"));
        assertTrue(h.executor.errors().isEmpty());
    }

    @Test
    void iteration_is_bound_in_loop_bodies() {
        ScriptHarness h = new ScriptHarness().start(
                "var sum = 0",
                "repeat(4) { sum = sum + iteration }",
                "var seen = 0",
                "loop {",
                "  if (iteration == 2) { continue }",
                "  seen = seen + 1",
                "  if (iteration >= 4) { break }",
                "}");

        assertEquals(0 + 1 + 2 + 3, h.intGlobal("sum"));
        assertEquals(4, h.intGlobal("seen"));
    }

    @Test
    void pause_freezes_delay_with_remaining_budget() {
        ScriptHarness h = new ScriptHarness().start(
                "delay(1000)",
                "var done = 1");

        h.advance(300);
        assertTrue(h.executor.pause());
        assertEquals(ExecutionState.PAUSED, h.executor.getState());

        h.advance(2000);
        assertNull(h.global("done"));

        assertTrue(h.executor.resume());
        h.advance(699);
        assertNull(h.global("done"));

        h.advance(1);
        assertEquals(1, h.intGlobal("done"));
        assertEquals(1000, h.executor.snapshot().getElapsedMillis());
    }

    @Test
    void paused_run_executes_no_statements() {
        ScriptHarness h = new ScriptHarness().start(
                "var x = 0",
                "loop { x = x + 1; delay(10) }");

        h.advance(35);
        long before = h.intGlobal("x");
        assertEquals(4, before);

        h.executor.pause();
        h.advance(500);
        assertEquals(before, h.intGlobal("x"));

        h.executor.resume();
        h.advance(10);
        assertEquals(before + 1, h.intGlobal("x"));
        h.executor.stop();
    }

    @Test
    void wait_for_timeout_reports_one_error_and_continues() {
        ScriptHarness h = new ScriptHarness().start(
                "wait_for(id == 0x7E8) timeout(500)",
                "var after = 1");

        h.advance(499);
        assertTrue(h.runtimeErrors().isEmpty());
        assertNull(h.global("after"));

        h.advance(1);
        List<ScriptError> errors = h.runtimeErrors();
        assertEquals(1, errors.size());
        assertEquals(ErrorKind.TIMEOUT, errors.get(0).getKind());
        assertEquals(1, errors.get(0).getLine());
        assertEquals(1, h.intGlobal("after"));
    }

    @Test
    void wait_for_timeout_runs_fallback_instead_of_error() {
        ScriptHarness h = new ScriptHarness().start(
                "var result = 0",
                "wait_for(id == 0x7E8) timeout(200) { result = -1 }",
                "var after = 1");

        h.advance(200);
        assertTrue(h.runtimeErrors().isEmpty());
        assertEquals(-1, h.intGlobal("result"));
        assertEquals(1, h.intGlobal("after"));
    }

    @Test
    void wait_for_binds_response_on_match() {
        ScriptHarness h = new ScriptHarness().start(
                "send(0x7DF, [0x02, 0x01, 0x0C])",
                "wait_for(id == 0x7E8 && data[2] == 0x0C) timeout(1000)",
                "var rpm = (response.data[3] << 8 | response.data[4]) / 4",
                "var from = response.id");

        h.advance(10);
        h.receive(0x7E9, 0x04, 0x41, 0x0C, 0x1A, 0xF8);
        assertNull(h.global("rpm"));

        h.receive(0x7E8, 0x04, 0x41, 0x0C, 0x1A, 0xF8);
        assertEquals((0x1A << 8 | 0xF8) / 4, h.intGlobal("rpm"));
        assertEquals(0x7E8, h.intGlobal("from"));
        assertTrue(h.runtimeErrors().isEmpty());

        // the timeout was cancelled by the match
        h.advance(2000);
        assertTrue(h.runtimeErrors().isEmpty());
    }

    @Test
    void wait_for_int_predicate_is_id_shorthand() {
        ScriptHarness h = new ScriptHarness().start(
                "wait_for(0x123) timeout(100)",
                "var got = response.dlc");

        h.receive(0x123, 1, 2);
        assertEquals(2, h.intGlobal("got"));
    }

    @Test
    void frame_arriving_while_paused_completes_wait_after_resume() {
        ScriptHarness h = new ScriptHarness().start(
                "wait_for(id == 0x10) timeout(1000)",
                "var got = 1");

        h.executor.pause();
        h.receive(0x10, 1);
        assertNull(h.global("got"));

        h.executor.resume();
        h.scheduler.runDueTasks();
        assertEquals(1, h.intGlobal("got"));
        assertTrue(h.runtimeErrors().isEmpty());
    }

    @Test
    void runtime_error_in_main_aborts_only_that_statement() {
        ScriptHarness h = new ScriptHarness().start(
                "var a = 1",
                "var b = a + \"x\" * 2",
                "var c = undefined_thing",
                "var d = 4");

        List<ScriptError> errors = h.runtimeErrors();
        assertEquals(2, errors.size(), errors::toString);
        assertEquals(ErrorKind.TYPE_ERROR, errors.get(0).getKind());
        assertEquals(2, errors.get(0).getLine());
        assertEquals(ErrorKind.UNDEFINED_VARIABLE, errors.get(1).getKind());
        assertEquals(3, errors.get(1).getLine());
        assertEquals(4, h.intGlobal("d"));
        assertEquals(ExecutionState.STOPPED, h.executor.getState());
    }

    @Test
    void on_receive_handler_sees_frame_fields() {
        ScriptHarness h = new ScriptHarness().start(
                "var count = 0",
                "var last = 0",
                "on_receive(id == 0x100) {",
                "  count = count + 1",
                "  last = data[0] + response.dlc",
                "}");

        assertEquals(ExecutionState.RUNNING, h.executor.getState());
        h.receive(0x100, 7);
        h.receive(0x200, 9);
        h.receive(0x100, 5, 0);

        assertEquals(2, h.intGlobal("count"));
        assertEquals(5 + 2, h.intGlobal("last"));
        assertEquals(3, h.executor.snapshot().getFramesReceived());
    }

    @Test
    void handler_error_abandons_only_that_activation() {
        ScriptHarness h = new ScriptHarness().start(
                "var ok = 0",
                "on_receive(true) {",
                "  var v = data[5]",
                "  ok = ok + 1",
                "}");

        h.receive(0x1, 1);
        h.receive(0x1, 1, 2, 3, 4, 5, 6);

        assertEquals(1, h.intGlobal("ok"));
        assertEquals(1, h.runtimeErrors().size());
        assertEquals(ErrorKind.INVALID_ARGUMENT, h.runtimeErrors().get(0).getKind());
    }

    @Test
    void failing_receive_predicate_disables_handler() {
        ScriptHarness h = new ScriptHarness().start(
                "var hits = 0",
                "on_receive(data[3] == 1) { hits = hits + 1 }");

        h.receive(0x1, 0);
        h.receive(0x1, 0, 0, 0, 1);

        assertEquals(0, h.intGlobal("hits"));
        assertEquals(1, h.runtimeErrors().size());
    }

    @Test
    void on_interval_fires_at_fixed_rate_and_never_after_stop() {
        ScriptHarness h = new ScriptHarness().start(
                "var ticks = 0",
                "on_interval(100) { ticks = ticks + 1 }");

        h.advance(350);
        assertEquals(3, h.intGlobal("ticks"));

        h.executor.stop();
        assertEquals(ExecutionState.IDLE, h.executor.getState());
        h.advance(1000);
        assertEquals(3, h.intGlobal("ticks"));
        assertEquals(0, h.scheduler.pendingTasks());
        assertEquals(0, h.bus.subscriberCount());
    }

    @Test
    void interval_tick_skipped_while_previous_activation_runs() {
        ScriptHarness h = new ScriptHarness().start(
                "var starts = 0",
                "on_interval(100) { starts = starts + 1; delay(250) }");

        h.advance(1000);
        // starts at 100, 400, 700, 1000
        assertEquals(4, h.intGlobal("starts"));
        h.executor.stop();
    }

    @Test
    void invalid_interval_period_is_reported_and_handler_disabled() {
        ScriptHarness h = new ScriptHarness().start(
                "on_interval(0) { print \"never\" }",
                "on_receive(true) { print \"frame\" }");

        assertEquals(1, h.runtimeErrors().size());
        assertEquals(ErrorKind.INVALID_ARGUMENT, h.runtimeErrors().get(0).getKind());
        h.advance(500);
        assertTrue(h.printed().isEmpty());
        h.executor.stop();
    }

    @Test
    void user_functions_in_statement_position_may_suspend() {
        ScriptHarness h = new ScriptHarness().start(
                "function pulse(fid, n) {",
                "  repeat(n) { send(fid, iteration); delay(10) }",
                "  return n * 2",
                "}",
                "var r = pulse(0x50, 3)",
                "var after = now()");

        assertEquals(1, h.bus.sent.size());
        h.advance(30);
        assertEquals(3, h.bus.sent.size());
        assertEquals(6, h.intGlobal("r"));
        assertEquals(30, h.intGlobal("after"));
    }

    @Test
    void nested_calls_run_synchronously() {
        ScriptHarness h = new ScriptHarness().start(
                "function sq(v) { return v * v }",
                "function sum3(a, b, c) { return a + b + c }",
                "var x = sum3(sq(1), sq(2), sq(3)) + 1",
                "var y = sq(sq(2))");

        assertEquals(15, h.intGlobal("x"));
        assertEquals(16, h.intGlobal("y"));
        assertTrue(h.executor.errors().isEmpty());
    }

    @Test
    void delay_inside_nested_call_is_an_error() {
        ScriptHarness h = new ScriptHarness().start(
                "function slow() { delay(10); return 1 }",
                "var x = 1 + slow()",
                "var after = 2");

        assertEquals(1, h.runtimeErrors().size());
        assertEquals(ErrorKind.GENERAL, h.runtimeErrors().get(0).getKind());
        assertNull(h.global("x"));
        assertEquals(2, h.intGlobal("after"));
    }

    @Test
    void recursion_limit_is_enforced() {
        TxScriptOptions options = new TxScriptOptions();
        options.setMaxCallDepth(8);
        ScriptHarness h = new ScriptHarness(options).start(
                "function down(n) { return down(n + 1) }",
                "down(0)",
                "var after = 1");

        assertEquals(1, h.runtimeErrors().size());
        assertTrue(h.runtimeErrors().get(0).getMessage().contains("call depth"));
        assertEquals(1, h.intGlobal("after"));
    }

    @Test
    void arity_mismatch_and_undefined_function() {
        ScriptHarness h = new ScriptHarness().start(
                "function f(a) { return a }",
                "f(1, 2)",
                "nothing_here(1)");

        List<ScriptError> errors = h.runtimeErrors();
        assertEquals(2, errors.size());
        assertEquals(ErrorKind.ARITY_MISMATCH, errors.get(0).getKind());
        assertEquals(ErrorKind.UNDEFINED_FUNCTION, errors.get(1).getKind());
    }

    @Test
    void send_validates_id_range_and_payload() {
        ScriptHarness h = new ScriptHarness().start(
                "send(0x800, [1])",
                "send(0x800, [1], ext)",
                "send(0x100, 256)",
                "send(0x100, \"text\")",
                "send(0x20000000, [1], true)",
                "send(0x7FF, random_bytes(8))");

        List<ScriptError> errors = h.runtimeErrors();
        assertEquals(4, errors.size(), errors::toString);
        assertEquals(ErrorKind.INVALID_ARGUMENT, errors.get(0).getKind());
        assertEquals(ErrorKind.INVALID_ARGUMENT, errors.get(1).getKind());
        assertEquals(ErrorKind.TYPE_ERROR, errors.get(2).getKind());
        assertEquals(ErrorKind.INVALID_ARGUMENT, errors.get(3).getKind());

        assertEquals(2, h.bus.sent.size());
        assertTrue(h.bus.sent.get(0).extended);
        assertEquals(8, h.bus.sent.get(1).data.length);
    }

    @Test
    void send_failures_are_non_fatal() {
        ScriptHarness h = new ScriptHarness();
        h.bus.failSends = true;
        h.start("send(0x100, 1)", "var after = 1");

        List<ScriptError> errors = h.runtimeErrors();
        assertEquals(1, errors.size());
        assertEquals(ErrorKind.SEND_ERROR, errors.get(0).getKind());
        assertTrue(errors.get(0).getMessage().contains("bus offline"));
        assertEquals(1, h.intGlobal("after"));
        assertEquals(0, h.executor.snapshot().getFramesSent());
    }

    @Test
    void rejected_send_is_reported() {
        ScriptHarness h = new ScriptHarness();
        h.bus.rejectSends = true;
        h.start("send(0x100, 1)");

        assertEquals(1, h.runtimeErrors().size());
        assertEquals(ErrorKind.SEND_ERROR, h.runtimeErrors().get(0).getKind());
    }

    @Test
    void start_rejects_scripts_with_errors() {
        ScriptHarness h = new ScriptHarness();

        assertFalse(h.executor.start("send(0x100 1)\nvar = 2", List.of(1)));
        assertEquals(ExecutionState.ERROR, h.executor.getState());
        assertFalse(h.executor.errors().byPhase(ErrorPhase.PARSE).isEmpty());

        // ERROR only leaves through stop()
        assertFalse(h.executor.start("var x = 1", List.of(1)));
        h.executor.stop();
        assertEquals(ExecutionState.IDLE, h.executor.getState());
        assertTrue(h.executor.start("var x = 1", List.of(1)));
    }

    @Test
    void start_while_running_returns_false() {
        ScriptHarness h = new ScriptHarness().start("on_receive(true) { print id }");

        assertFalse(h.executor.start("var y = 2", List.of(1)));
        assertEquals(ExecutionState.RUNNING, h.executor.getState());
        h.executor.stop();
    }

    @Test
    void stop_is_idempotent_and_restart_works() {
        ScriptHarness h = new ScriptHarness().start("loop { delay(100) }");

        h.executor.stop();
        h.executor.stop();
        assertEquals(ExecutionState.IDLE, h.executor.getState());
        assertFalse(h.executor.pause());
        assertFalse(h.executor.resume());

        assertTrue(h.executor.start("var again = 1", List.of(1)));
        h.scheduler.runDueTasks();
        assertEquals(1, h.intGlobal("again"));
        assertEquals(ExecutionState.STOPPED, h.executor.getState());
    }

    @Test
    void stop_builtin_ends_run_in_stopped_state() {
        ScriptHarness h = new ScriptHarness().start(
                "var n = 0",
                "on_interval(10) { n = n + 1; if (n == 3) { stop() } }");

        h.advance(100);
        assertEquals(3, h.intGlobal("n"));
        assertEquals(ExecutionState.STOPPED, h.executor.getState());
    }

    @Test
    void state_listeners_and_log_see_every_transition() {
        ScriptHarness h = new ScriptHarness();
        List<String> transitions = new ArrayList<>();
        h.executor.addStateListener((from, to) -> transitions.add(from + ">" + to));

        h.start("delay(10)", "print \"done\"");
        h.executor.pause();
        h.executor.resume();
        h.advance(10);

        assertEquals(List.of("IDLE>RUNNING", "RUNNING>PAUSED", "PAUSED>RUNNING", "RUNNING>STOPPED"), transitions);
        assertEquals(4, h.executor.log().entries(ScriptLogEntry.Type.STATE).size());
        assertEquals(List.of("done"), h.printed());
    }

    @Test
    void snapshot_tracks_line_and_iteration() {
        ScriptHarness h = new ScriptHarness().start(
                "var x = 0",
                "repeat(5) {",
                "  delay(10)",
                "}");

        h.advance(25);
        ExecutionSnapshot s = h.executor.snapshot();
        assertEquals(ExecutionState.RUNNING, s.getState());
        assertEquals(3, s.getCurrentLine());
        assertEquals(2, s.getLoopIteration());
    }

    @Test
    void busy_loop_yields_to_handlers() {
        TxScriptOptions options = new TxScriptOptions();
        options.setStepBudget(50);
        ScriptHarness h = new ScriptHarness(options);

        // the loop only ends once the handler has run, so drive it through receive()
        assertTrue(h.executor.start(String.join("\n",
                "var spins = 0",
                "var seen = 0",
                "on_receive(true) { seen = 1 }",
                "loop { spins = spins + 1; if (seen == 1) { break } }"), List.of(1)));
        h.receive(0x1, 0);

        assertEquals(1, h.intGlobal("seen"));
        assertTrue(h.intGlobal("spins") > 0);
        assertEquals(ExecutionState.RUNNING, h.executor.getState());
        h.executor.stop();
    }

    @Test
    void print_concatenates_values() {
        ScriptHarness h = new ScriptHarness().start(
                "var b = [0x02, 0x01, 0x0C]",
                "print(\"id=\", hex(0x7E8), \" data=\", b, \" len=\", len(b))",
                "print 1.5");

        assertEquals(List.of("id=0x7E8 data=[02 01 0C] len=3", "1.5"), h.printed());
    }

    @Test
    void index_assignment_replaces_byte() {
        ScriptHarness h = new ScriptHarness().start(
                "var b = [1, 2, 3]",
                "b[1] = 0xFF",
                "b[3] = 1");

        assertArrayEquals(new byte[] { 1, (byte) 0xFF, 3 }, h.global("b").asBytes());
        assertEquals(1, h.runtimeErrors().size());
    }

    @Test
    void each_start_begins_with_empty_error_and_run_logs() {
        TxScriptOptions options = new TxScriptOptions();
        options.setMaxErrors(2);
        ScriptHarness h = new ScriptHarness(options).start(
                "var x = a",
                "var y = b",
                "var z = c");
        assertEquals(2, h.executor.errors().size());
        assertEquals(1, h.executor.errors().droppedCount());
        h.executor.stop();

        assertTrue(h.executor.start("var ok = 1\nvar w = d", List.of(1)));
        h.scheduler.runDueTasks();

        List<ScriptError> errors = h.executor.errors().snapshot();
        assertEquals(1, errors.size(), errors::toString);
        assertTrue(errors.get(0).getMessage().contains("'d'"));
        assertEquals(0, h.executor.errors().droppedCount());
        assertEquals(1, h.executor.snapshot().getErrorCount());
        assertEquals(1, h.executor.log().entries(ScriptLogEntry.Type.ERROR).size());
    }

    @Test
    void throwing_error_listener_does_not_stall_handlers() {
        ScriptHarness h = new ScriptHarness();
        h.executor.errors().addListener(e -> {
            throw new IllegalStateException("ui gone");
        });
        h.start(
                "var n = 0",
                "on_interval(100) { n = n + 1; undefined_x }");

        assertDoesNotThrow(() -> h.advance(1000));
        assertEquals(10, h.intGlobal("n"));
        assertEquals(10, h.runtimeErrors().size());
        h.executor.stop();
    }

    @Test
    void throwing_log_listener_does_not_stop_main_sequence() {
        ScriptHarness h = new ScriptHarness();
        h.executor.log().addListener(entry -> {
            if (entry.getType() == ScriptLogEntry.Type.INFO) throw new IllegalStateException("console closed");
        });
        h.start(
                "var n = 0",
                "print \"hi\"",
                "n = 1");

        assertEquals(1, h.intGlobal("n"));
        assertEquals(List.of("hi"), h.printed());
        assertEquals(ExecutionState.STOPPED, h.executor.getState());
    }
}
