package me.golemcore.todo.adapter.inbound.console;

import me.golemcore.todo.infrastructure.config.TodoProperties;
import me.golemcore.todo.port.inbound.CommandPort;
import me.golemcore.todo.port.inbound.CommandPort.CommandResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ConsoleChannelTest {

    private CommandPort commandPort;
    private StringWriter output;

    @BeforeEach
    void setUp() {
        commandPort = mock(CommandPort.class);
        when(commandPort.execute(any(), anyList())).thenReturn(CommandResult.success("ok"));
        output = new StringWriter();
    }

    private ConsoleChannel channelWithInput(String input) {
        ConsoleIo io = new ConsoleIo(new BufferedReader(new StringReader(input)), new PrintWriter(output, true));
        return new ConsoleChannel(commandPort, io, new TodoProperties());
    }

    @Test
    void tokenize_splitsOnWhitespace() {
        assertEquals(List.of("done", "3"), ConsoleChannel.tokenize("  done   3 "));
        assertTrue(ConsoleChannel.tokenize("   ").isEmpty());
    }

    @Test
    void tokenize_keepsQuotedSegmentsTogether() {
        assertEquals(List.of("add", "Buy milk", "20-10-2026", "it's late"),
                ConsoleChannel.tokenize("add \"Buy milk\" 20-10-2026 \"it's late\""));
        assertEquals(List.of("add", "Essay draft"), ConsoleChannel.tokenize("add 'Essay draft'"));
    }

    @Test
    void tokenize_emptyQuotesYieldEmptyToken() {
        assertEquals(List.of("edit", "1", ""), ConsoleChannel.tokenize("edit 1 \"\""));
    }

    @Test
    void tokenize_unterminatedQuoteRunsToEndOfLine() {
        assertEquals(List.of("search", "open ended"), ConsoleChannel.tokenize("search \"open ended"));
    }

    @Test
    void normalizeCommand_stripsSlashAndLowercases() {
        assertEquals("list", ConsoleChannel.normalizeCommand("/LIST"));
        assertEquals("done", ConsoleChannel.normalizeCommand("Done"));
    }

    @Test
    void run_rendersListThenDispatchesEachLine() {
        channelWithInput("add \"Buy milk\" 20-10-2026\n\n/DONE 1\nquit\nlist\n").run();

        verify(commandPort).execute("list", List.of());
        verify(commandPort).execute("add", List.of("Buy milk", "20-10-2026"));
        verify(commandPort).execute("done", List.of("1"));
        verify(commandPort, times(3)).execute(any(), anyList());
    }

    @Test
    void run_stopsAtEndOfInput() {
        channelWithInput("progress\n").run();

        verify(commandPort).execute(eq("progress"), anyList());
        assertTrue(output.toString().contains("todo> "));
    }

    @Test
    void run_prefixesFailures() {
        when(commandPort.execute(eq("done"), anyList())).thenReturn(CommandResult.failure("Task #7 not found"));

        channelWithInput("done 7\nexit\n").run();

        assertTrue(output.toString().contains("! Task #7 not found"));
    }
}
