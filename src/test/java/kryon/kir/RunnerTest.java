package kryon.kir;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 命令行入口测试。
 */
public class RunnerTest {

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();

  private int run(String... args) {
    return Runner.run(args,
        new PrintStream(out, true, StandardCharsets.UTF_8),
        new PrintStream(err, true, StandardCharsets.UTF_8));
  }

  private String stdout() {
    return out.toString(StandardCharsets.UTF_8);
  }

  private static Path write(Path dir, String name, String content) throws Exception {
    Path file = dir.resolve(name);
    Files.write(file, content.getBytes(StandardCharsets.UTF_8));
    return file;
  }

  @Test
  public void testInspectPrintsOutline(@TempDir Path dir) throws Exception {
    Path input = write(dir, "app.kir", KirDecoderTest.resource("complete.kir"));
    assertEquals(Runner.EXIT_OK, run("inspect", input.toString()));
    String text = stdout();
    assertTrue(text.startsWith("Column #1 (5 children)\n"), text);
    assertTrue(text.contains("\n  Row #4 (2 children)\n    Button #5\n"), text);
  }

  @Test
  public void testNormalizeAssignsIds(@TempDir Path dir) throws Exception {
    Path input = write(dir, "bare.kir", "{\"type\":\"Row\",\"children\":[{\"type\":\"Text\",\"properties\":{\"textContent\":\"x\"}}]}");
    Path output = dir.resolve("normalized.kir");
    assertEquals(Runner.EXIT_OK, run("normalize", input.toString(), "--out=" + output));
    String json = new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
    assertTrue(json.contains("\"version\":\"2.0\""));
    assertTrue(json.contains("\"type\":\"Row\",\"id\":1"));
    assertTrue(json.contains("\"type\":\"Text\",\"id\":2"));
  }

  @Test
  public void testCodegenPython(@TempDir Path dir) throws Exception {
    Path input = write(dir, "app.kir", KirDecoderTest.resource("complete.kir"));
    assertEquals(Runner.EXIT_OK, run("codegen", input.toString(), "--lang=python"));
    assertTrue(stdout().contains("app = Column("));
  }

  @Test
  public void testCodegenJavaWithNames(@TempDir Path dir) throws Exception {
    Path input = write(dir, "app.kir", KirDecoderTest.resource("complete.kir"));
    assertEquals(Runner.EXIT_OK, run("codegen", input.toString(), "--lang=java", "--package=com.example", "--class=CounterView"));
    assertTrue(stdout().contains("package com.example;"));
    assertTrue(stdout().contains("public final class CounterView {"));
  }

  @Test
  public void testUsageErrors(@TempDir Path dir) throws Exception {
    Path input = write(dir, "app.kir", "{\"type\":\"Text\"}");
    assertEquals(Runner.EXIT_USAGE, run());
    assertEquals(Runner.EXIT_USAGE, run("explode", input.toString()));
    assertEquals(Runner.EXIT_USAGE, run("inspect", input.toString(), "--verbose"));
    assertEquals(Runner.EXIT_USAGE, run("codegen", input.toString(), "--lang=cobol"));
  }

  @Test
  public void testInputErrors(@TempDir Path dir) throws Exception {
    assertEquals(Runner.EXIT_INPUT, run("inspect", dir.resolve("missing.kir").toString()));
    Path broken = write(dir, "broken.kir", "{\"type\":");
    assertEquals(Runner.EXIT_INPUT, run("normalize", broken.toString()));
    Path badHeading = write(dir, "heading.kir", "{\"type\":\"Heading\",\"properties\":{\"text\":\"x\",\"level\":8}}");
    assertEquals(Runner.EXIT_INPUT, run("inspect", badHeading.toString()));
    assertTrue(err.toString(StandardCharsets.UTF_8).contains("got 8"));
  }

  @Test
  public void testContextConfigDrivesDebugAndPretty(@TempDir Path dir) throws Exception {
    Path input = write(dir, "bare.kir", "{\"type\":\"Text\"}");
    KirContext context = new KirContext(new KirContext.ConfigView(true, "lua", true, false));
    int code = Runner.run(new String[] {"normalize", input.toString()},
        new PrintStream(out, true, StandardCharsets.UTF_8),
        new PrintStream(err, true, StandardCharsets.UTF_8),
        context);
    assertEquals(Runner.EXIT_OK, code);
    assertTrue(err.toString(StandardCharsets.UTF_8).contains("DEBUG: command=normalize"));
    assertTrue(stdout().contains("\"version\" : \"2.0\""), "上下文开启缩进输出");
  }
}
