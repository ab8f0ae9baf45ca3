/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */


package io.vastgen.command;

import io.vastgen.command.archive.CMD_archive;
import io.vastgen.command.cleanup.CMD_cleanup;
import io.vastgen.command.generate.CMD_generate;
import io.vastgen.command.run.CMD_run;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;

/// Entry point of the `vastgen` command line.
@Command(name = "vastgen",
    mixinStandardHelpOptions = true,
    header = "generate scenario variants and run them on a cluster",
    description = """
        Expands a variation specification into concrete variants, runs one isolated
        cluster job per variant, and archives the results of a run.""",
    subcommands = {
        CMD_generate.class,
        CMD_run.class,
        CMD_archive.class,
        CMD_cleanup.class,
        HelpCommand.class
    })
public class CMD_vastgen {

    /// @return a command line configured the way [#main] runs it
    public static CommandLine commandLine() {
        return new CommandLine(new CMD_vastgen())
            .setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        System.setProperty("slf4j.internal.verbosity", "ERROR");
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
