package com.airledger.service.audit;

import com.airledger.core.ledger.ChainVerificationResult;
import com.airledger.core.ledger.LedgerVerifier;
import com.airledger.service.store.JsonlLedgerStore;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Stand-alone chain verification. Exit code 0 when the ledger is intact, 1 when it is not, 2 on usage or
 * read errors.
 */
public final class VerifyLedgerMain {
    private VerifyLedgerMain() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Path ledgerFile = args.length > 0
                ? Path.of(args[0])
                : Path.of(System.getenv().getOrDefault("AIRLEDGER_DATA_DIR", "data")).resolve("ledger.jsonl");
        if (!Files.exists(ledgerFile)) {
            err.println("Ledger file not found: " + ledgerFile);
            return 2;
        }

        ChainVerificationResult result;
        try {
            result = new LedgerVerifier(new JsonlLedgerStore(ledgerFile)).verifyChain();
        } catch (RuntimeException e) {
            err.println("Unable to read ledger " + ledgerFile + ": " + e.getMessage());
            return 2;
        }

        if (result.valid()) {
            out.println("OK: " + result.totalEntries() + " entries verified in " + ledgerFile);
            return 0;
        }
        out.println("FAILED (" + result.failure() + ") at sequence " + result.brokenAtSequence()
                + " of " + result.totalEntries() + ": " + result.errorMessage());
        return 1;
    }
}
