package io.github.eutro.exnorm.analysis;

import io.github.eutro.exnorm.ast.Match;
import io.github.eutro.exnorm.conf.NormalizerConfig;
import io.github.eutro.exnorm.ext.CommonExts;

import java.util.regex.Pattern;

/**
 * Decides whether a binder is a compiler temporary.
 * <p>
 * A {@link CommonExts#COMPILER_TEMP} flag carried on the match is authoritative, either way.
 * Without it, the naming conventions of the generator are used.
 */
public final class TempNames {
    private static final Pattern CONVENTIONAL = Pattern.compile("temp_\\w+|tmp(_\\w+)?|_g\\d*|g\\d+|this\\d+");

    private TempNames() {
    }

    public static boolean isTemp(Match match, String name, NormalizerConfig config) {
        Boolean flag = match.getNullable(CommonExts.COMPILER_TEMP);
        if (flag != null) return flag;
        return isTempName(name, config);
    }

    public static boolean isTempName(String name, NormalizerConfig config) {
        if (CONVENTIONAL.matcher(name).matches()) return true;
        for (String prefix : config.getTempPrefixes()) {
            if (name.startsWith(prefix)) return true;
        }
        return false;
    }
}
