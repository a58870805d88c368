package kryon.kir;

import kryon.kir.runtime.interop.InMemoryIrLibrary;
import kryon.kir.runtime.interop.IrLibrary;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

public class KirContextTest {

  @Test
  public void testLibraryIsCreatedLazilyOnce() {
    AtomicInteger created = new AtomicInteger();
    KirContext.ConfigView config = new KirContext.ConfigView(false, "kotlin", false, false);
    KirContext context = new KirContext(config, () -> {
      created.incrementAndGet();
      return new InMemoryIrLibrary();
    });

    assertEquals(0, created.get(), "构造上下文时不创建引擎");
    IrLibrary first = context.getLibrary();
    assertSame(first, context.getLibrary());
    assertEquals(1, created.get());
  }

  @Test
  public void testEncoderUsesConfiguredLanguage() {
    KirContext context = new KirContext(new KirContext.ConfigView(true, "lua", true, false));
    assertEquals("lua", context.newEncoder().language());
    assertTrue(context.getConfig().isDebugEnabled());
    assertTrue(context.getConfig().isPrettyEnabled());
    assertFalse(context.getConfig().isStrictKeys());

    String json = context.getLibrary().serializeComplete(kryon.kir.nodes.Components.container(), null, null, null, null);
    assertTrue(json.contains("\"language\" : \"lua\""), "默认引擎沿用上下文配置（缩进输出）");
  }

  @Test
  public void testStrictKeysReachTheCodecs() {
    KirContext strict = new KirContext(new KirContext.ConfigView(false, "java", false, true));
    assertTrue(strict.newEncoder().isStrictKeys());
    assertTrue(strict.newDecoder().isStrictKeys());
    KirContext lenient = new KirContext(new KirContext.ConfigView(false, "java", false, false));
    assertFalse(lenient.newEncoder().isStrictKeys());

    Logger logger = Logger.getLogger(kryon.kir.runtime.CaseTranscoder.class.getName());
    List<LogRecord> records = new ArrayList<>();
    Handler handler = new Handler() {
      @Override
      public void publish(LogRecord record) {
        records.add(record);
      }

      @Override
      public void flush() {}

      @Override
      public void close() {}
    };
    logger.addHandler(handler);
    try {
      strict.newEncoder().encode(kryon.kir.nodes.Components.container().setAttribute("foo__bar", 1));
      assertTrue(records.stream().anyMatch(r -> r.getLevel() == Level.WARNING), "严格模式下不可逆键名以 WARNING 记录");

      records.clear();
      lenient.newEncoder().encode(kryon.kir.nodes.Components.container().setAttribute("foo__bar", 1));
      assertTrue(records.stream().noneMatch(r -> r.getLevel() == Level.WARNING), "宽松模式不产生 WARNING");
    } finally {
      logger.removeHandler(handler);
    }
  }
}
