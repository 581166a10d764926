package com.edwardjones.adtree.cli;

import com.edwardjones.adtree.model.dto.TreeRequest;
import org.springframework.boot.ApplicationArguments;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps command-line options onto a {@link TreeRequest}.
 *
 * <pre>
 * --identity=&lt;group&gt; [--server=&lt;host&gt;] [--show-all] [--group] [--depth=&lt;n&gt;] [--recursive]
 * </pre>
 * {@code --identity} may be repeated, and every non-option argument is taken as a further identity.
 */
public final class TreeArguments {

    public static final String IDENTITY = "identity";
    public static final String SERVER = "server";
    public static final String SHOW_ALL = "show-all";
    public static final String GROUP = "group";
    public static final String DEPTH = "depth";
    public static final String RECURSIVE = "recursive";

    private TreeArguments() {
    }

    public static boolean isTreeInvocation(ApplicationArguments args) {
        return args.containsOption(IDENTITY) || !args.getNonOptionArgs().isEmpty();
    }

    /**
     * Every identity named on the command line, in the order given.
     *
     * @throws IllegalArgumentException if there is none or one of them is blank
     */
    public static List<String> identities(ApplicationArguments args) {
        String option = "--" + IDENTITY;
        List<String> identities = new ArrayList<>();
        for (String arg : args.getSourceArgs()) {
            if (arg.equals(option)) {
                identities.add("");
            } else if (arg.startsWith(option + "=")) {
                identities.add(arg.substring(option.length() + 1));
            } else if (!arg.startsWith("--")) {
                identities.add(arg);
            }
        }

        if (identities.isEmpty() || identities.stream().anyMatch(String::isBlank)) {
            throw new IllegalArgumentException("Identity is required");
        }
        return identities;
    }

    /**
     * The options shared by all identities, bound to the first of them.
     */
    public static TreeRequest toRequest(ApplicationArguments args, int defaultDepth) {
        String identity = identities(args).get(0);

        String depthValue = singleValue(args, DEPTH);
        int depth = defaultDepth;
        if (depthValue != null) {
            try {
                depth = Integer.parseInt(depthValue.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for --" + DEPTH + ": '" + depthValue + "'", e);
            }
        }

        boolean recursive = flag(args, RECURSIVE);
        if (recursive && depthValue != null) {
            throw new IllegalArgumentException("--" + DEPTH + " and --" + RECURSIVE + " cannot be combined");
        }

        return new TreeRequest(
                identity,
                singleValue(args, SERVER),
                flag(args, SHOW_ALL),
                flag(args, GROUP),
                depth,
                recursive);
    }

    private static String singleValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(values.size() - 1);
    }

    private static boolean flag(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) {
            return false;
        }
        String value = singleValue(args, name);
        return value == null || !"false".equalsIgnoreCase(value.trim());
    }
}
