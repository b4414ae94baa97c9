package com.toolgate.dispatch.cli;

import com.toolgate.core.mode.ModeManager;
import com.toolgate.core.mode.OperatingMode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: toolgate modes
 * <p>
 * Lists the operating modes in cycle order and marks the configured initial mode.
 */
@Command(name = "modes", mixinStandardHelpOptions = true, description = "List operating modes")
@Component
public class ModesCommand implements Runnable {

    private final ModeManager modeManager;

    public ModesCommand(ModeManager modeManager) {
        this.modeManager = modeManager;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        OperatingMode current = modeManager.currentMode();
        for (OperatingMode mode : OperatingMode.CYCLE_ORDER) {
            ConsoleOutput.mode(mode, mode == current);
        }
    }
}
