package tech.clusterops.sdk.transaction;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;
import tech.clusterops.sdk.exception.TransactionLogException;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * On-disk record of transactions.
 *
 * <p>Layout under the log directory:
 * <pre>
 * pending_transaction.json                      the transaction being committed, if any
 * history/{yyyyMMdd_HHmmss}_{id}_{status}.json  finished transactions, by UTC creation time
 * </pre>
 *
 * <p>The pending file is replaced atomically where the filesystem allows it and is readable by
 * the owner only, since a {@code CreateUser} operation carries a password. Single writer.
 */
public class TransactionLog {

    private static final Logger LOG = Logger.getLogger(TransactionLog.class);

    public static final String PENDING_FILE = "pending_transaction.json";
    public static final String HISTORY_DIR = "history";

    private static final DateTimeFormatter ARCHIVE_TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);
    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

    private final Path directory;
    private final ObjectMapper objectMapper;

    public TransactionLog(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    public Path directory() {
        return directory;
    }

    public Path pendingFile() {
        return directory.resolve(PENDING_FILE);
    }

    public Path historyDirectory() {
        return directory.resolve(HISTORY_DIR);
    }

    /**
     * The transaction left behind by an interrupted commit, if any.
     */
    public Optional<Transaction> loadPending() {
        Path pending = pendingFile();
        if (!Files.exists(pending)) {
            return Optional.empty();
        }
        return Optional.of(read(pending));
    }

    public void savePending(Transaction transaction) {
        Path pending = pendingFile();
        Path temp = directory.resolve(PENDING_FILE + ".tmp");
        try {
            Files.createDirectories(directory);
            writeOwnerOnly(temp, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(transaction));
            try {
                Files.move(temp, pending, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, pending, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new TransactionLogException("Failed to write pending transaction " + transaction.id()
                + " to " + pending, e);
        }
        LOG.debugf("Saved pending transaction %s to %s", transaction.id(), pending);
    }

    public void clearPending() {
        try {
            Files.deleteIfExists(pendingFile());
        } catch (IOException e) {
            throw new TransactionLogException("Failed to delete " + pendingFile(), e);
        }
    }

    /**
     * Write the transaction, in its current terminal status, to the history directory.
     *
     * @return the archive file
     */
    public Path archive(Transaction transaction) {
        TransactionStatus status = transaction.status();
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Transaction " + transaction.id() + " is still " + status.label());
        }
        Path history = historyDirectory();
        Path target = history.resolve(ARCHIVE_TIMESTAMP.format(transaction.createdAt())
            + "_" + transaction.id() + "_" + status.label() + ".json");
        try {
            Files.createDirectories(history);
            writeOwnerOnly(target, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(transaction));
        } catch (IOException e) {
            throw new TransactionLogException("Failed to archive transaction " + transaction.id() + " to " + target, e);
        }
        LOG.debugf("Archived transaction %s as %s", transaction.id(), target.getFileName());
        return target;
    }

    /**
     * Archived transaction files, newest first.
     */
    public List<Path> history() {
        Path history = historyDirectory();
        if (!Files.isDirectory(history)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(history)) {
            return files
                .filter(p -> p.getFileName().toString().endsWith(".json"))
                .sorted(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed())
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new TransactionLogException("Failed to list " + history, e);
        }
    }

    public Transaction read(Path file) {
        try {
            return objectMapper.readValue(file.toFile(), Transaction.class);
        } catch (IOException e) {
            throw new TransactionLogException("Failed to read transaction from " + file, e);
        }
    }

    /**
     * Write {@code content} to a file that is never readable by others, not even while it is
     * being written. Replaces any existing file.
     */
    private static void writeOwnerOnly(Path file, byte[] content) throws IOException {
        if (file.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            FileAttribute<Set<PosixFilePermission>> ownerOnly = PosixFilePermissions.asFileAttribute(OWNER_ONLY);
            Files.deleteIfExists(file);
            Files.createFile(file, ownerOnly);
        }
        Files.write(file, content);
    }
}
