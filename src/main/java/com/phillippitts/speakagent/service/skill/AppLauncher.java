package com.phillippitts.speakagent.service.skill;

import java.io.IOException;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so {@link OpenAppSkill} can be tested without
 * starting real processes.
 */
public interface AppLauncher {

    /**
     * Starts the application and returns without waiting for it.
     *
     * @param command full command line, with the executable as the first element
     * @throws IOException if the process cannot be started
     */
    void launch(List<String> command) throws IOException;
}
