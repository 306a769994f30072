package com.ryuqq.solar.bootstrap;

import com.ryuqq.solar.bootstrap.cli.SolarCommand;
import picocli.CommandLine;

/**
 * 프로세스 진입점.
 *
 * @author Solar Team
 * @since 1.0.0
 */
public final class Main {

    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new SolarCommand()).execute(args);
        System.exit(code);
    }
}
