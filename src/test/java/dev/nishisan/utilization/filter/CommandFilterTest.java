/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura at gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */

package dev.nishisan.utilization.filter;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandFilterTest {

    @Test
    void shouldMatchLiteralAgainstExecutableBasename() {
        CommandFilter filter = CommandFilter.of(List.of("sshd"));

        assertTrue(filter.matches(List.of("/usr/sbin/sshd", "-D")));
        assertTrue(filter.matches(List.of("sshd")));
        assertFalse(filter.matches(List.of("/usr/bin/ssh", "sshd")));
        assertFalse(filter.matches(List.of("/usr/sbin/sshd-keygen")));
    }

    @Test
    void shouldMatchGlobAgainstJoinedCommandLine() {
        CommandFilter filter = CommandFilter.of(List.of("*.py"));

        assertTrue(filter.matches(List.of("/usr/bin/python3", "train.py")));
        assertFalse(filter.matches(List.of("/usr/bin/python3")));
        assertFalse(filter.matches(List.of("/usr/bin/python3", "train.py", "--epochs", "3")));
    }

    @Test
    void shouldCombineLiteralsAndGlobs() {
        CommandFilter filter = CommandFilter.of(List.of("java", "*jupyter*"));

        assertInstanceOf(CommandFilter.NamedPattern.class, filter);
        assertTrue(filter.matches(List.of("/opt/jdk/bin/java", "-jar", "app.jar")));
        assertTrue(filter.matches(List.of("/usr/bin/python3", "-m", "jupyter", "lab")));
        assertFalse(filter.matches(List.of("/bin/bash")));
    }

    @Test
    void shouldReturnAllProcessesForSingleStar() {
        CommandFilter filter = CommandFilter.of(List.of("*"));

        assertSame(CommandFilter.allProcesses(), filter);
        assertTrue(filter.matches(null));
        assertTrue(filter.matches(List.of()));
        assertTrue(filter.matches(List.of("anything")));
    }

    @Test
    void shouldNotMatchUnreadableCommandWithoutStarGlob() {
        CommandFilter literal = CommandFilter.of(List.of("sshd"));
        CommandFilter glob = CommandFilter.of(List.of("*.py"));

        assertFalse(literal.matches(null));
        assertFalse(literal.matches(List.of()));
        assertFalse(glob.matches(null));
    }

    @Test
    void shouldMatchUnreadableCommandWhenStarIsAmongOtherRules() {
        CommandFilter filter = CommandFilter.of(List.of("sshd", "*"));

        assertInstanceOf(CommandFilter.NamedPattern.class, filter);
        assertTrue(filter.matches(null));
        assertTrue(filter.matches(List.of("/bin/bash")));
    }

    @Test
    void shouldTreatQuestionMarkOnlyNameAsLiteral() {
        CommandFilter filter = CommandFilter.of(List.of("a?c"));

        assertTrue(filter.matches(List.of("/bin/a?c")));
        assertFalse(filter.matches(List.of("/bin/abc")));
    }

    @Test
    void shouldRejectEmptyOrBlankPatterns() {
        IllegalArgumentException none = assertThrows(IllegalArgumentException.class,
                () -> CommandFilter.of(List.of()));
        assertEquals("no patterns", none.getMessage());

        IllegalArgumentException blank = assertThrows(IllegalArgumentException.class,
                () -> CommandFilter.of(List.of("sshd", " ")));
        assertEquals("blank pattern", blank.getMessage());

        assertThrows(IllegalArgumentException.class, () -> CommandFilter.of(null));
    }
}
