package io.linkmesh;

import io.linkmesh.cli.LinkMeshCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new LinkMeshCommand()).execute(args);
        System.exit(code);
    }
}
