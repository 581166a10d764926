package com.edwardjones.adtree;

import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

import java.util.Arrays;

@SpringBootApplication
public class AdTreeApplication {

    public static void main(String[] args) {
        new SpringApplicationBuilder(AdTreeApplication.class)
                .web(isCommandLineRun(args) ? WebApplicationType.NONE : WebApplicationType.SERVLET)
                .run(args);
    }

    // A tree requested on the command line is printed and the JVM exits; no web server is started.
    static boolean isCommandLineRun(String[] args) {
        return Arrays.stream(args).anyMatch(arg -> arg.startsWith("--identity") || !arg.startsWith("--"));
    }
}
