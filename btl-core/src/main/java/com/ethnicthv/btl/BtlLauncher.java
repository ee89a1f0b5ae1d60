package com.ethnicthv.btl;

import com.ethnicthv.btl.core.report.ConsoleStyle;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line driver.
 * <p>
 * Without arguments, runs every suite registered by {@code GeneratedSuites}. Otherwise each
 * argument is the fully qualified name of a subject type and only those suites run, in
 * argument order. Exit status: {@code 0} all assertions passed, {@code 1} at least one
 * failed, {@code 2} a subject could not be resolved.
 * <p>
 * Colours are on unless {@code -Dbtl.color=false} or {@code NO_COLOR} is set.
 */
public final class BtlLauncher {

    static final int EXIT_UNKNOWN_SUBJECT = 2;

    private BtlLauncher() {}

    public static void main(String[] args) {
        BTL.Builder builder = BTL.builder().style(ConsoleStyle.fromEnvironment());
        System.exit(launch(builder, args));
    }

    /**
     * Build the run from {@code builder}, execute the requested suites and return the exit status.
     */
    static int launch(BTL.Builder builder, String[] args) {
        BTL btl = builder.build();
        if (args.length == 0) {
            btl.runAll();
            return btl.exitCode();
        }

        PrintStream err = btl.getRunner().getReporter().errorStream();
        List<Class<?>> subjects = new ArrayList<>(args.length);
        for (String name : args) {
            Class<?> subject;
            try {
                subject = Class.forName(name, false, BtlLauncher.class.getClassLoader());
            } catch (ClassNotFoundException e) {
                err.println("[BTL] Error: subject type '" + name + "' not found on the classpath");
                return EXIT_UNKNOWN_SUBJECT;
            }
            if (!btl.getRegistry().isRegistered(subject)) {
                err.println("[BTL] Error: no suite registered for '" + name + "'");
                return EXIT_UNKNOWN_SUBJECT;
            }
            subjects.add(subject);
        }
        for (Class<?> subject : subjects) {
            btl.run(subject);
        }
        return btl.exitCode();
    }
}
