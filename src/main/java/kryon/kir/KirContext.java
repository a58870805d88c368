package kryon.kir;

import kryon.kir.runtime.KirConfig;
import kryon.kir.runtime.interop.InMemoryIrLibrary;
import kryon.kir.runtime.interop.IrLibrary;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * KIR 运行时上下文。
 *
 * 持有配置快照，并延迟创建组件引擎（{@link IrLibrary}）。上下文由调用方显式传递，不存在进程级单例。
 */
public final class KirContext {
  private final ConfigView configView;
  private final Supplier<IrLibrary> libraryFactory;
  private final AtomicReference<IrLibrary> libraryRef = new AtomicReference<>();

  public KirContext() {
    // 预先捕捉静态配置，避免执行过程中反复读取环境变量
    this(new ConfigView(KirConfig.DEBUG, KirConfig.DEFAULT_LANGUAGE, KirConfig.PRETTY, KirConfig.STRICT_KEYS));
  }

  public KirContext(ConfigView configView) {
    this.configView = Objects.requireNonNull(configView, "configView");
    this.libraryFactory = () -> new InMemoryIrLibrary(newEncoder(), newDecoder(), configView.isPrettyEnabled());
  }

  /**
   * 使用自定义的引擎工厂（例如原生绑定）。
   */
  public KirContext(ConfigView configView, Supplier<IrLibrary> libraryFactory) {
    this.configView = Objects.requireNonNull(configView, "configView");
    this.libraryFactory = Objects.requireNonNull(libraryFactory, "libraryFactory");
  }

  /**
   * 返回配置快照。
   */
  public ConfigView getConfig() {
    return configView;
  }

  /**
   * 延迟初始化组件引擎；并发调用时只有一个实例胜出。
   */
  public IrLibrary getLibrary() {
    IrLibrary current = libraryRef.get();
    if (current != null) {
      return current;
    }
    IrLibrary created = libraryFactory.get();
    return libraryRef.compareAndSet(null, created) ? created : libraryRef.get();
  }

  public KirEncoder newEncoder() {
    return new KirEncoder(configView.getLanguage(), configView.isStrictKeys());
  }

  public KirDecoder newDecoder() {
    return new KirDecoder(configView.isStrictKeys());
  }

  /**
   * 配置快照，仅包含运行时常用的几个开关。
   */
  public static final class ConfigView {
    private final boolean debugEnabled;
    private final String language;
    private final boolean prettyEnabled;
    private final boolean strictKeys;

    public ConfigView(boolean debugEnabled, String language, boolean prettyEnabled, boolean strictKeys) {
      this.debugEnabled = debugEnabled;
      this.language = Objects.requireNonNull(language, "language");
      this.prettyEnabled = prettyEnabled;
      this.strictKeys = strictKeys;
    }

    public boolean isDebugEnabled() {
      return debugEnabled;
    }

    public String getLanguage() {
      return language;
    }

    public boolean isPrettyEnabled() {
      return prettyEnabled;
    }

    public boolean isStrictKeys() {
      return strictKeys;
    }
  }
}
