package com.hidego.crypto;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.Optional;
import java.util.Set;

/**
 * Obtains the master passphrase from an interactive console and checks it against a
 * salted verification record on disk. On first start the record does not exist yet:
 * the passphrase is entered twice and the record is written.
 * <p>
 * Record layout: {@code salt[32] || PBKDF2(base64(PBKDF2(passphrase, salt)), salt)[32]}.
 */
public class PassphrasePrompt {

    private static final Logger log = LoggerFactory.getLogger(PassphrasePrompt.class);

    static final int MIN_LENGTH = 12;
    static final int MAX_ATTEMPTS = 3;
    private static final Set<String> EXIT_WORDS = Set.of("0", "q", "exit");
    private static final int RECORD_LENGTH = Encryptor.SALT_LENGTH + KeyDerivation.KEY_LENGTH_BYTES;

    private final SecretConsole console;
    private final Path recordFile;
    private final SecureRandom random = new SecureRandom();

    public PassphrasePrompt(SecretConsole console, Path recordFile) {
        this.console = console;
        this.recordFile = recordFile;
    }

    public Optional<MasterPassphrase> obtain() {
        if (Files.exists(recordFile)) {
            return verifyExisting(readRecord());
        }
        return setUpNew();
    }

    private Optional<MasterPassphrase> verifyExisting(byte[] record) {
        byte[] salt = Arrays.copyOfRange(record, 0, Encryptor.SALT_LENGTH);
        byte[] expected = Arrays.copyOfRange(record, Encryptor.SALT_LENGTH, RECORD_LENGTH);

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            char[] entered = console.readSecret("Enter master passphrase (0, q or exit to quit): ");
            if (entered == null || isExitWord(entered)) {
                return Optional.empty();
            }
            if (MessageDigest.isEqual(expected, verificationDigest(entered, salt))) {
                console.println("Passphrase verified.");
                return Optional.of(wrap(entered));
            }
            int remaining = MAX_ATTEMPTS - attempt;
            console.println(remaining > 0
                    ? "Incorrect passphrase. " + remaining + " attempt(s) left."
                    : "Incorrect passphrase. No attempts left.");
        }
        log.warn("Master passphrase verification failed {} times", MAX_ATTEMPTS);
        return Optional.empty();
    }

    private Optional<MasterPassphrase> setUpNew() {
        console.println("No passphrase record found at " + recordFile + ". Creating a new one.");
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            char[] entered = console.readSecret(
                    "Choose a master passphrase (min " + MIN_LENGTH + " characters, 0, q or exit to quit): ");
            if (entered == null || isExitWord(entered)) {
                return Optional.empty();
            }
            if (entered.length < MIN_LENGTH) {
                console.println("Passphrase must be at least " + MIN_LENGTH + " characters.");
                continue;
            }
            char[] confirmation = console.readSecret("Confirm master passphrase: ");
            if (confirmation == null) {
                return Optional.empty();
            }
            if (!Arrays.equals(entered, confirmation)) {
                console.println("Passphrases do not match.");
                continue;
            }
            writeRecord(entered);
            console.println("Passphrase record created.");
            return Optional.of(wrap(entered));
        }
        return Optional.empty();
    }

    private void writeRecord(char[] passphrase) {
        byte[] salt = new byte[Encryptor.SALT_LENGTH];
        random.nextBytes(salt);
        byte[] digest = verificationDigest(passphrase, salt);
        byte[] record = new byte[RECORD_LENGTH];
        System.arraycopy(salt, 0, record, 0, salt.length);
        System.arraycopy(digest, 0, record, salt.length, digest.length);
        try {
            Path parent = recordFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(recordFile, record);
            restrictPermissions();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write passphrase record " + recordFile, e);
        }
        log.info("Wrote passphrase verification record {}", recordFile);
    }

    private void restrictPermissions() throws IOException {
        try {
            Files.setPosixFilePermissions(recordFile, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException e) {
            log.debug("File system does not support POSIX permissions for {}", recordFile);
        }
    }

    private byte[] readRecord() {
        try {
            byte[] record = Files.readAllBytes(recordFile);
            if (record.length != RECORD_LENGTH) {
                throw new IllegalStateException("Passphrase record " + recordFile + " is corrupt");
            }
            return record;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read passphrase record " + recordFile, e);
        }
    }

    static byte[] verificationDigest(char[] passphrase, byte[] salt) {
        byte[] key = KeyDerivation.pbkdf2(passphrase, salt);
        char[] encodedKey = Base64.getEncoder().encodeToString(key).toCharArray();
        return KeyDerivation.pbkdf2(encodedKey, salt);
    }

    private static boolean isExitWord(char[] entered) {
        return EXIT_WORDS.contains(new String(entered).trim().toLowerCase());
    }

    private static MasterPassphrase wrap(char[] entered) {
        MasterPassphrase passphrase = new MasterPassphrase(entered);
        Arrays.fill(entered, '\0');
        return passphrase;
    }
}
