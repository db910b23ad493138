package io.enumeris.registry;

import io.enumeris.core.EnumerisConfiguration;
import io.enumeris.logging.RecordingSlf4jServiceProvider;
import io.enumeris.logging.RecordingSlf4jServiceProvider.LogEvent;
import io.enumeris.testutil.Token;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EnumerationLoggingTest {

    static final class Shared {
        static final Enumeration<Token> OWN =
                Enumeration.of(Token.class, Shared.class, EnumerisConfiguration.builder().name("Own").build());
        static final Enumeration<Token> OTHER =
                Enumeration.of(Token.class, Shared.class, EnumerisConfiguration.builder().name("Other").build());

        static final Token MINE = OWN.declare(Token::new);
        static final Token THEIRS = OTHER.declare(Token::new);
    }

    @BeforeEach
    void clearEvents() {
        RecordingSlf4jServiceProvider.clear();
    }

    @Test
    void shouldLogDeclarationsAtDebug() {
        var tokens = Enumeration.of(Token.class, EnumerisConfiguration.builder().name("Logged").build());
        tokens.declare("first", Token::new);
        tokens.declare(10, Token::new);

        assertThat(eventsFrom(Enumeration.class))
                .filteredOn(e -> e.level() == Level.DEBUG)
                .extracting(LogEvent::message)
                .contains("Declared first #0 in enumeration Logged", "Declared (unnamed) #10 in enumeration Logged");
    }

    @Test
    void shouldWarnWhenNameSourceReportsForeignValue() {
        assertThat(Shared.MINE).hasToString("MINE");

        assertThat(eventsFrom(Enumeration.class))
                .filteredOn(e -> e.level() == Level.WARN)
                .extracting(LogEvent::message)
                .contains("Ignoring declared name 'THEIRS': value belongs to enumeration Other, not Own");
        assertThat(Shared.OWN.findByName("THEIRS")).isEmpty();
        assertThat(Shared.OTHER.valueByName("THEIRS")).isSameAs(Shared.THEIRS);
    }

    @Test
    void shouldLogNamePopulationAtDebug() {
        var tokens = Enumeration.of(Token.class, EnumerisConfiguration.builder()
                .name("Populated")
                .nameSource((declaringClass, valueType) -> List.of())
                .build());
        var token = tokens.declare(Token::new);

        assertThat(token.toString()).startsWith("<Invalid enum");
        assertThat(eventsFrom(Enumeration.class))
                .extracting(LogEvent::message)
                .contains("Populated 0 declared names for enumeration Populated");
    }

    private static List<LogEvent> eventsFrom(Class<?> type) {
        return RecordingSlf4jServiceProvider.events().stream()
                .filter(e -> e.loggerName().equals(type.getName()))
                .toList();
    }
}
