package io.github.manjago.switchboard;

import io.github.manjago.switchboard.command.Command;
import io.github.manjago.switchboard.command.CommandGroup;
import io.github.manjago.switchboard.command.CommandRegistry;
import io.github.manjago.switchboard.option.Flag;
import io.github.manjago.switchboard.option.KeyedOption;
import io.github.manjago.switchboard.option.OptionGroup;
import io.github.manjago.switchboard.option.ValueType;
import io.github.manjago.switchboard.param.ParameterSignature;

/**
 * Shared command trees for tests.
 * 
 * <pre>
 * tool [-q]
 *   build &lt;target&gt; [&lt;mode&gt;]   -r, -j &lt;int&gt;, --json | --yaml
 *   test/ [--verbose]
 *     unit [&lt;filters&gt;] ...
 *     e2e                       -n &lt;string&gt;
 *   greet &lt;name&gt; [&lt;greeting&gt;]
 *   help, version
 * </pre>
 */
public final class TestRegistries {
    
    public static final Flag QUIET = Flag.of("-q", "--quiet", "Less output");
    public static final Flag RELEASE = Flag.of("-r", "--release", "Release build");
    public static final KeyedOption<Integer> JOBS = KeyedOption.of("-j", "--jobs", ValueType.INT, "Parallel jobs");
    public static final Flag JSON = new Flag("--json");
    public static final Flag YAML = new Flag("--yaml");
    public static final Flag VERBOSE = new Flag(new String[] {"--verbose"}, "Verbose test output");
    public static final KeyedOption<String> NAME = KeyedOption.of("-n", "--name", "Scenario name");
    
    private TestRegistries() {}
    
    public static CommandRegistry.Builder toolBuilder() {
        Command build = Command.builder("build")
                .description("Builds a target")
                .option(RELEASE)
                .option(JOBS)
                .option(JSON)
                .option(YAML)
                .optionGroup(OptionGroup.atMostOne(JSON, YAML))
                .signature(ParameterSignature.builder().required("target").optional("mode", "debug").build())
                .build();
        
        CommandGroup test = CommandGroup.builder("test")
                .description("Runs tests")
                .sharedOption(VERBOSE)
                .child(Command.builder("unit")
                        .description("Runs unit tests")
                        .signature(ParameterSignature.builder().variadic("filters").build())
                        .build())
                .child(Command.builder("e2e")
                        .description("Runs end-to-end tests")
                        .option(NAME)
                        .build())
                .build();
        
        Command greet = Command.builder("greet")
                .description("Greets someone")
                .signature(ParameterSignature.builder().required("name").optional("greeting", "Hello").build())
                .build();
        
        return CommandRegistry.builder("tool")
                .description("A tool for tests")
                .version("1.2.3")
                .globalOption(QUIET)
                .command(build)
                .command(test)
                .command(greet);
    }
    
    public static CommandRegistry tool() {
        return toolBuilder().build();
    }
}
