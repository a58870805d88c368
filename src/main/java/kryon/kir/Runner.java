package kryon.kir;

import kryon.kir.codegen.KirCodegen;
import kryon.kir.codegen.SourceRegenerator;
import kryon.kir.core.Node;
import kryon.kir.runtime.KirException;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 命令行入口。
 *
 * <pre>
 * Runner inspect   &lt;input.kir&gt;
 * Runner normalize &lt;input.kir&gt; [--pretty] [--out=&lt;file&gt;]
 * Runner codegen   &lt;input.kir&gt; --lang=java|python [--class=&lt;Name&gt;] [--package=&lt;pkg&gt;] [--out=&lt;file&gt;]
 * </pre>
 *
 * 退出码：0 成功，1 用法错误，2 输入错误（格式/校验/IO）。
 */
public final class Runner {
  public static final int EXIT_OK = 0;
  public static final int EXIT_USAGE = 1;
  public static final int EXIT_INPUT = 2;

  private Runner() {}

  public static void main(String[] args) {
    int code = run(args, System.out, System.err);
    if (code != EXIT_OK) {
      System.exit(code);
    }
  }

  public static int run(String[] args, PrintStream out, PrintStream err) {
    return run(args, out, err, new KirContext());
  }

  /**
   * 使用给定上下文执行；语言、缩进与调试开关都取自上下文的配置快照。
   */
  public static int run(String[] args, PrintStream out, PrintStream err, KirContext context) {
    if (args.length < 2) {
      printUsage(err);
      return EXIT_USAGE;
    }
    String command = args[0];
    Path input = Paths.get(args[1]);

    // Parse --flag and --flag=value options after the input path
    boolean pretty = context.getConfig().isPrettyEnabled();
    String lang = null;
    String className = null;
    String packageName = null;
    Path outPath = null;
    for (int i = 2; i < args.length; i++) {
      String a = args[i];
      if ("--pretty".equals(a)) pretty = true;
      else if (a.startsWith("--lang=")) lang = a.substring("--lang=".length());
      else if (a.startsWith("--class=")) className = a.substring("--class=".length());
      else if (a.startsWith("--package=")) packageName = a.substring("--package=".length());
      else if (a.startsWith("--out=")) outPath = Paths.get(a.substring("--out=".length()));
      else {
        err.println("Unknown option: " + a);
        printUsage(err);
        return EXIT_USAGE;
      }
    }

    boolean debug = context.getConfig().isDebugEnabled();
    if (debug) {
      err.println("DEBUG: command=" + command);
      err.println("DEBUG: input=" + input.toAbsolutePath());
    }

    SourceRegenerator generator = null;
    if ("codegen".equals(command)) {
      try {
        generator = KirCodegen.forLanguage(lang == null ? "java" : lang, packageName, className);
      } catch (IllegalArgumentException e) {
        err.println(e.getMessage());
        return EXIT_USAGE;
      }
    } else if (!"inspect".equals(command) && !"normalize".equals(command)) {
      err.println("Unknown command: " + command);
      printUsage(err);
      return EXIT_USAGE;
    }

    try {
      byte[] bytes = Files.readAllBytes(input);
      String result;
      switch (command) {
        case "inspect": {
          Node root = context.newDecoder().decode(bytes);
          StringBuilder sb = new StringBuilder();
          outline(sb, root, 0);
          result = sb.toString();
          break;
        }
        case "normalize": {
          KirDocument doc = context.newDecoder().decodeDocument(bytes);
          result = context.newEncoder().encodeToString(doc, pretty) + "\n";
          break;
        }
        default: {
          Node root = context.newDecoder().decode(bytes);
          result = generator.generate(root);
          break;
        }
      }
      if (outPath != null) {
        Files.write(outPath, result.getBytes(StandardCharsets.UTF_8));
      } else {
        out.print(result);
      }
      return EXIT_OK;
    } catch (IOException e) {
      err.println("I/O error: " + e.getMessage());
      return EXIT_INPUT;
    } catch (KirException e) {
      err.println(e.getMessage());
      if (debug) {
        e.printStackTrace(err);
      }
      return EXIT_INPUT;
    }
  }

  /**
   * 每个节点一行：缩进 + 类型名 + id（有时）+ 子节点数。
   */
  private static void outline(StringBuilder sb, Node node, int depth) {
    sb.append("  ".repeat(depth)).append(node.kind().toWireName());
    if (node.hasId()) {
      sb.append(" #").append(node.id());
    }
    if (node.childCount() > 0) {
      sb.append(" (").append(node.childCount()).append(node.childCount() == 1 ? " child)" : " children)");
    }
    sb.append('\n');
    for (Node child : node.children()) {
      outline(sb, child, depth + 1);
    }
  }

  private static void printUsage(PrintStream err) {
    err.println("Usage: Runner <command> <input.kir> [options]");
    err.println("  inspect                               Print a kind/id outline of the tree");
    err.println("  normalize [--pretty] [--out=<file>]   Decode then re-encode (assigns missing ids)");
    err.println("  codegen --lang=java|python [--class=<Name>] [--package=<pkg>] [--out=<file>]");
    err.println("");
    err.println("Examples:");
    err.println("  Runner inspect app.kir");
    err.println("  Runner normalize app.kir --pretty --out=app.normalized.kir");
    err.println("  Runner codegen app.kir --lang=python");
  }
}
