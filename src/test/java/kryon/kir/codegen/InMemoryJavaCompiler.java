package kryon.kir.codegen;

import kryon.kir.core.Node;

import javax.tools.*;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 测试辅助：在内存中编译生成的 Java 源码并加载。
 */
final class InMemoryJavaCompiler {

  private InMemoryJavaCompiler() {}

  static Class<?> compileAndLoad(String fullClassName, String code) throws Exception {
    JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
    if (compiler == null) {
      throw new IllegalStateException("No system Java compiler available (running on a JRE?)");
    }
    DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
    InMemoryFileManager fileManager = new InMemoryFileManager(compiler.getStandardFileManager(diagnostics, null, null));
    JavaFileObject source = new InMemorySourceFile(fullClassName, code);
    List<String> options = List.of("-classpath", classPath());
    JavaCompiler.CompilationTask task = compiler.getTask(null, fileManager, diagnostics, options, null, List.of(source));

    if (!task.call()) {
      StringBuilder msg = new StringBuilder("Compilation failed:\n");
      diagnostics.getDiagnostics().forEach(d -> msg.append(d).append('\n'));
      msg.append(code);
      throw new AssertionError(msg.toString());
    }

    ClassLoader loader = new InMemoryClassLoader(Node.class.getClassLoader(), fileManager.classBytes());
    return loader.loadClass(fullClassName);
  }

  // 生成的代码引用 kryon.kir.*，需要把主代码目录放到编译期类路径上
  private static String classPath() throws Exception {
    String mainClasses = Paths.get(Node.class.getProtectionDomain().getCodeSource().getLocation().toURI()).toString();
    return mainClasses + File.pathSeparator + System.getProperty("java.class.path");
  }

  private static final class InMemorySourceFile extends SimpleJavaFileObject {
    private final String code;

    InMemorySourceFile(String className, String code) {
      super(URI.create("string:///" + className.replace('.', '/') + Kind.SOURCE.extension), Kind.SOURCE);
      this.code = code;
    }

    @Override
    public CharSequence getCharContent(boolean ignoreEncodingErrors) {
      return code;
    }
  }

  private static final class InMemoryClassFile extends SimpleJavaFileObject {
    private final ByteArrayOutputStream outputStream = new ByteArrayOutputStream();

    InMemoryClassFile(String className) {
      super(URI.create("bytes:///" + className.replace('.', '/') + Kind.CLASS.extension), Kind.CLASS);
    }

    @Override
    public OutputStream openOutputStream() {
      return outputStream;
    }
  }

  private static final class InMemoryFileManager extends ForwardingJavaFileManager<StandardJavaFileManager> {
    private final Map<String, InMemoryClassFile> classFiles = new HashMap<>();

    InMemoryFileManager(StandardJavaFileManager fileManager) {
      super(fileManager);
    }

    @Override
    public JavaFileObject getJavaFileForOutput(Location location, String className, JavaFileObject.Kind kind, FileObject sibling)
        throws IOException {
      if (kind == JavaFileObject.Kind.CLASS) {
        InMemoryClassFile file = new InMemoryClassFile(className);
        classFiles.put(className, file);
        return file;
      }
      return super.getJavaFileForOutput(location, className, kind, sibling);
    }

    Map<String, byte[]> classBytes() {
      Map<String, byte[]> out = new HashMap<>();
      classFiles.forEach((name, file) -> out.put(name, file.outputStream.toByteArray()));
      return out;
    }
  }

  private static final class InMemoryClassLoader extends ClassLoader {
    private final Map<String, byte[]> classBytes;

    InMemoryClassLoader(ClassLoader parent, Map<String, byte[]> classBytes) {
      super(parent);
      this.classBytes = classBytes;
    }

    @Override
    protected Class<?> findClass(String name) throws ClassNotFoundException {
      byte[] bytes = classBytes.get(name);
      if (bytes != null) {
        return defineClass(name, bytes, 0, bytes.length);
      }
      return super.findClass(name);
    }
  }
}
