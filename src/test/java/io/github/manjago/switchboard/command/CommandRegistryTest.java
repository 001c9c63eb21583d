package io.github.manjago.switchboard.command;

import io.github.manjago.switchboard.TestRegistries;
import io.github.manjago.switchboard.core.ConfigurationException;
import io.github.manjago.switchboard.core.ShortFlagSplitter;
import io.github.manjago.switchboard.option.Flag;
import io.github.manjago.switchboard.option.KeyedOption;
import io.github.manjago.switchboard.option.Option;
import io.github.manjago.switchboard.option.OptionGroup;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandRegistryTest {
    
    @Nested
    @DisplayName("Built-ins")
    class Builtins {
        
        @Test
        @DisplayName("help and version follow the user commands")
        void builtinsAppended() {
            CommandRegistry registry = TestRegistries.tool();
            List<String> names = registry.root().children().stream().map(Routable::name).toList();
            
            assertEquals(List.of("build", "test", "greet", "help", "version"), names);
            assertNotNull(registry.helpCommand());
            assertNotNull(registry.versionCommand());
            assertEquals("1.2.3", registry.version());
        }
        
        @Test
        @DisplayName("No version string means no version command")
        void noVersion() {
            CommandRegistry registry = TestRegistries.toolBuilder().version(null).build();
            
            assertNull(registry.versionCommand());
            assertNull(registry.root().child("version"));
        }
        
        @Test
        @DisplayName("help command and help flag can be disabled")
        void disableHelp() {
            CommandRegistry registry = TestRegistries.toolBuilder()
                    .helpCommand(false)
                    .helpFlag(false)
                    .build();
            
            assertNull(registry.helpCommand());
            assertNull(registry.root().child("help"));
            assertNull(registry.helpFlag());
            assertEquals(List.of(TestRegistries.QUIET), registry.root().sharedOptions());
        }
        
        @Test
        @DisplayName("help flag is a global option")
        void helpFlagIsGlobal() {
            CommandRegistry registry = TestRegistries.tool();
            assertTrue(registry.root().sharedOptions().contains(registry.helpFlag()));
        }
    }
    
    @Nested
    @DisplayName("Validation at build time")
    class Validation {
        
        @Test
        @DisplayName("Duplicate spelling between command and global options")
        void duplicateWithGlobal() {
            Command clash = Command.builder("clash").option(new Flag("-q")).build();
            
            ConfigurationException e = assertThrows(ConfigurationException.class,
                    () -> TestRegistries.toolBuilder().command(clash).build());
            assertTrue(e.getMessage().contains("-q"), e.getMessage());
        }
        
        @Test
        @DisplayName("Duplicate spelling with an ancestor's shared option")
        void duplicateWithShared() {
            CommandGroup group = CommandGroup.builder("g")
                    .sharedOption(new Flag("-x"))
                    .child(Command.builder("c").option(KeyedOption.of("-x", "--ex", "")).build())
                    .build();
            
            assertThrows(ConfigurationException.class,
                    () -> CommandRegistry.builder("tool").command(group).build());
        }
        
        @Test
        @DisplayName("Duplicate spelling with the help flag")
        void duplicateWithHelpFlag() {
            Command c = Command.builder("c").option(new Flag("-h")).build();
            
            assertThrows(ConfigurationException.class,
                    () -> CommandRegistry.builder("tool").command(c).build());
            assertDoesNotThrow(
                    () -> CommandRegistry.builder("tool").helpFlag(false).command(c).build());
        }
        
        @Test
        @DisplayName("Same spelling in sibling commands is fine")
        void siblingsMayShareSpellings() {
            Command a = Command.builder("a").option(new Flag("-x")).build();
            Command b = Command.builder("b").option(new Flag("-x")).build();
            
            assertDoesNotThrow(() -> CommandRegistry.builder("tool").command(a).command(b).build());
        }
        
        @Test
        @DisplayName("Two children with the same name")
        void duplicateChildNames() {
            assertThrows(ConfigurationException.class, () -> CommandGroup.builder("g")
                    .child(Command.builder("x").build())
                    .child(Command.builder("x").build())
                    .build());
        }
        
        @Test
        @DisplayName("User command named help clashes with the built-in")
        void userHelpClashes() {
            Command help = Command.builder("help").build();
            
            assertThrows(ConfigurationException.class,
                    () -> CommandRegistry.builder("tool").command(help).build());
            assertDoesNotThrow(
                    () -> CommandRegistry.builder("tool").helpCommand(false).command(help).build());
        }
        
        @Test
        @DisplayName("Option group member must be visible")
        void groupMemberMustBeVisible() {
            Flag declared = new Flag("--a");
            Flag stranger = new Flag("--b");
            Command c = Command.builder("c")
                    .option(declared)
                    .optionGroup(OptionGroup.atMostOne(declared, stranger))
                    .build();
            
            assertThrows(ConfigurationException.class,
                    () -> CommandRegistry.builder("tool").command(c).build());
        }
        
        @Test
        @DisplayName("Invalid command names")
        void invalidNames() {
            assertThrows(ConfigurationException.class, () -> Command.builder("").build());
            assertThrows(ConfigurationException.class, () -> Command.builder("two words").build());
        }
    }
    
    @Test
    @DisplayName("Short-flag splitter is registered first and can be turned off")
    void manipulators() {
        assertInstanceOf(ShortFlagSplitter.class, TestRegistries.tool().manipulators().get(0));
        assertTrue(TestRegistries.toolBuilder().splitShortFlags(false).build().manipulators().isEmpty());
    }
    
    @Test
    @DisplayName("Visible options: own, then shared innermost first, then global")
    void visibleOptionOrder() {
        CommandRegistry registry = TestRegistries.tool();
        CommandGroup test = (CommandGroup) registry.root().child("test");
        Command e2e = (Command) test.child("e2e");
        
        List<Option> visible = GroupPath.of(registry.root()).append(test).resolve(e2e).visibleOptions();
        
        assertEquals(List.of(TestRegistries.NAME, TestRegistries.VERBOSE, TestRegistries.QUIET, registry.helpFlag()),
                visible);
    }
}
