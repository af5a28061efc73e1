package com.phillippitts.speakagent.service.skill;

import java.io.IOException;
import java.util.List;

/**
 * Default production implementation of {@link AppLauncher} using {@link ProcessBuilder}.
 */
public final class ProcessAppLauncher implements AppLauncher {

    @Override
    public void launch(List<String> command) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        // The launched app outlives the request; its output is not ours to read.
        pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        pb.start();
    }
}
