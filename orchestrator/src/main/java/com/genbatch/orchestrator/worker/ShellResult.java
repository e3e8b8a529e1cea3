package com.genbatch.orchestrator.worker;

public record ShellResult(int exitCode, String stdout, String stderr) {

    public boolean ok() {
        return exitCode == 0;
    }
}
