package module;

import init.Config;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AnalysisOptionsTest {

    @Test
    public void defaultsComeFromConfig() {
        AnalysisOptions options = AnalysisOptions.fromConfig();
        assertEquals(Config.maxIterations, options.getMaxIterations());
        assertEquals(Config.perPathTimeout, options.getPerPathTimeout());
        assertEquals(Config.randomSeed, options.getRandomSeed());
    }

    @Test
    public void overridesReturnCopies() {
        AnalysisOptions base = AnalysisOptions.fromConfig();
        AnalysisOptions changed = base.withMaxIterations(3).withSolverTimeoutMillis(10).withRandomSeed(7L);
        assertEquals(3, changed.getMaxIterations());
        assertEquals(10, changed.getSolverTimeoutMillis());
        assertEquals(7L, changed.getRandomSeed());
        assertEquals(Config.maxIterations, base.getMaxIterations());
        assertThrows(IllegalArgumentException.class, () -> base.withMaxIterations(0));
    }
}
