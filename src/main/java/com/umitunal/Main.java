package com.umitunal;

import com.umitunal.examples.*;

/**
 * Main class that runs all batchq examples.
 */
public class Main {
    public static void main(String[] args) throws Exception {
        System.out.println("=== batchq Examples ===\n");

        // Run all examples
        BasicExample.main(args);
        RetryExample.main(args);
        BackgroundWorkersExample.main(args);

        System.out.println("\n=== All Examples Complete ===");
    }
}
