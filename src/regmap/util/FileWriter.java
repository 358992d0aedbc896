package regmap.util;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/*
 * Class for writing generated files.
 */
public class FileWriter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** key: file relative path, value: content in order of addition */
  private final Map<String, StringBuilder> contents = new LinkedHashMap<>();
  public String tab = "  ";
  public int nrTabs = 0;

  /**
   * Appends text to a file, aligned to the current tab level.
   *
   * @param file The relative path to the file. The path string should be equal for all updates that target the same file.
   * @param text The text to add; use "\n" line breaks for multi-line text. The final line break is added implicitly.
   */
  public void UpdateContent(String file, String text) {
    String aligned = new VHDL(tab).AlignText(tab.repeat(nrTabs), text);
    contents.computeIfAbsent(file, file_ -> new StringBuilder()).append(aligned).append(System.lineSeparator());
  }

  public boolean HasFile(String file) { return contents.containsKey(file); }

  public String GetContent(String file) {
    StringBuilder sb = contents.get(file);
    return sb == null ? null : sb.toString();
  }

  /**
   * Writes all files to the output directory, creating directories as necessary.
   * @return false if a file could not be written
   */
  public boolean WriteFiles(String out_path) {
    boolean success = true;
    for (Map.Entry<String, StringBuilder> entry : contents.entrySet())
      success &= WriteFile(entry.getKey(), entry.getValue().toString(), out_path);
    return success;
  }

  private boolean WriteFile(String file, String content, String out_path) {
    File outFile = Paths.get(out_path, file).toFile();
    File parent = outFile.getParentFile();
    if (parent != null)
      parent.mkdirs();
    logger.info("Writing " + outFile);
    try (PrintWriter out = new PrintWriter(new OutputStreamWriter(new FileOutputStream(outFile), StandardCharsets.UTF_8))) {
      out.print(content);
      return !out.checkError();
    } catch (IOException e) {
      logger.fatal("File " + file + " could not be written: " + e.getMessage());
      return false;
    }
  }
}
