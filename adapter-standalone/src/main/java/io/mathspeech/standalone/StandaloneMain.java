package io.mathspeech.standalone;

import io.mathspeech.standalone.cli.ConverterApp;

/**
 * Entry point for the command-line converter.
 *
 * <p>
 * Delegates to {@link ConverterApp#run} and exits with its status code.
 */
public final class StandaloneMain {

    private StandaloneMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code --config math-speech.yaml '\frac{1}{2}'})
     */
    public static void main(String[] args) {
        int status = new ConverterApp().run(args, System.in, System.out, System.err);
        if (status != ConverterApp.EXIT_OK) {
            System.exit(status);
        }
    }
}
