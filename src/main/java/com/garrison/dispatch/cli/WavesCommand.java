package com.garrison.dispatch.cli;

import com.garrison.core.escalation.WaveTable;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: garrison waves
 * <p>
 * Prints the configured escalation table.
 */
@Command(name = "waves", mixinStandardHelpOptions = true, description = "Show the configured reinforcement waves")
@Component
public class WavesCommand implements Runnable {

    private final WaveTable waveTable;

    public WavesCommand(WaveTable waveTable) {
        this.waveTable = waveTable;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        waveTable.ascending().forEach(ConsoleOutput::waveSpec);
    }
}
