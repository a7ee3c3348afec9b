package com.scrib.cli;

import com.scrib.container.exceptions.CorruptFormatException;
import com.scrib.files.FileService;
import com.scrib.files.FileType;
import com.scrib.files.config.FileServiceConfig;
import com.scrib.files.model.EditorContent;
import com.scrib.markup.delta.DeltaCodec;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * Command-line front end for encrypting, decrypting and converting documents.
 *
 * <pre>
 * Usage:
 *   java -jar scrib-cli.jar &lt;command&gt; &lt;input&gt; &lt;output&gt; [--password &lt;pw&gt;]
 *
 * Commands:
 *   encrypt        Read a .txt or .rtf file and write it as an encrypted .scrb container.
 *   decrypt        Decrypt a .scrb container into a .txt or .rtf file.
 *   rtf-to-delta   Convert an .rtf file to Delta JSON.
 *   delta-to-rtf   Convert Delta JSON to an .rtf file.
 *
 * Options:
 *   --password &lt;pw&gt;   Container password (encrypt and decrypt only)
 *
 * Exit codes:
 *   0  success
 *   1  usage, format or I/O error
 *   2  wrong password or corrupt container
 * </pre>
 */
public class ScribCli {

  static final int OK = 0;
  static final int ERROR = 1;
  static final int AUTH_FAILURE = 2;

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  /**
   * Runs one command.
   *
   * @param args the arguments
   * @param out  standard output
   * @param err  standard error
   * @return the exit code
   */
  static int run(String[] args, PrintStream out, PrintStream err) {
    String password = null;
    List<String> positional = new ArrayList<>();

    for (int i = 0; i < args.length; i++) {
      switch (args[i]) {
        case "--password" -> {
          if (i + 1 >= args.length) {
            err.println("--password needs a value");
            return ERROR;
          }
          password = args[++i];
        }
        case "--help", "-h" -> {
          printUsage(out);
          return OK;
        }
        default -> positional.add(args[i]);
      }
    }

    if (positional.size() != 3) {
      printUsage(err);
      return ERROR;
    }

    String command = positional.get(0);
    Path input = Path.of(positional.get(1));
    Path output = Path.of(positional.get(2));

    FileService service = new FileService(FileServiceConfig.DEFAULT);
    try {
      switch (command) {
        case "encrypt" -> runEncrypt(service, input, output, requirePassword(password));
        case "decrypt" -> runDecrypt(service, input, output, requirePassword(password));
        case "rtf-to-delta" -> runRtfToDelta(service, input, output);
        case "delta-to-rtf" -> runDeltaToRtf(service, input, output);
        default -> {
          err.println("Unknown command: " + command);
          printUsage(err);
          return ERROR;
        }
      }
      out.println("Wrote " + output);
      return OK;
    } catch (CompletionException e) {
      return report(e.getCause() == null ? e : e.getCause(), err);
    } catch (RuntimeException e) {
      return report(e, err);
    } finally {
      service.shutdown();
    }
  }

  private static int report(Throwable failure, PrintStream err) {
    if (failure instanceof SecurityException) {
      err.println("Wrong password or corrupt file");
      return AUTH_FAILURE;
    }
    if (failure instanceof CorruptFormatException) {
      err.println(failure.getMessage());
      return ERROR;
    }
    err.println("Error: " + failure.getMessage());
    return ERROR;
  }

  private static String requirePassword(String password) {
    if (password == null || password.isEmpty()) {
      throw new IllegalArgumentException("--password is required");
    }
    return password;
  }

  private static void runEncrypt(FileService service, Path input, Path output, String password) {
    if (FileType.fromPath(input) == FileType.ENCRYPTED) {
      throw new IllegalArgumentException("Input is already encrypted: " + input);
    }
    EditorContent content = service.open(input, null).join();
    service.writeEncrypted(output, content, password).join();
  }

  private static void runDecrypt(FileService service, Path input, Path output, String password) {
    if (FileType.fromPath(output) == FileType.ENCRYPTED) {
      throw new IllegalArgumentException("Output must be a .txt or .rtf file: " + output);
    }
    EditorContent content = service.readEncrypted(input, password).join();
    service.save(output, content, null).join();
  }

  private static void runRtfToDelta(FileService service, Path input, Path output) {
    DeltaCodec deltaCodec = new DeltaCodec();
    String delta = deltaCodec.toDelta(service.readRich(input).join());
    service.writeText(output, delta).join();
  }

  private static void runDeltaToRtf(FileService service, Path input, Path output) {
    DeltaCodec deltaCodec = new DeltaCodec();
    service.writeRich(output, deltaCodec.fromDelta(service.readText(input).join())).join();
  }

  private static void printUsage(PrintStream stream) {
    stream.println("Usage: scrib <command> <input> <output> [--password <pw>]");
    stream.println("Commands:");
    stream.println("  encrypt        .txt/.rtf -> .scrb");
    stream.println("  decrypt        .scrb -> .txt/.rtf");
    stream.println("  rtf-to-delta   .rtf -> Delta JSON");
    stream.println("  delta-to-rtf   Delta JSON -> .rtf");
  }
}
