package io.github.panghy.pdbbridge.rpc;

import java.util.List;

/**
 * Renders published interfaces as bus introspection XML.
 */
public final class IntrospectionXml {

  private IntrospectionXml() {
  }

  /**
   * Renders a node holding the given interfaces.
   *
   * @param interfaces The interfaces
   * @return The introspection document
   */
  public static String render(List<InterfaceInfo> interfaces) {
    StringBuilder xml = new StringBuilder("<node>\n");
    for (InterfaceInfo info : interfaces) {
      xml.append("  <interface name='").append(escape(info.name())).append("'>\n");
      for (MethodInfo method : info.methods()) {
        xml.append("    <method name='").append(escape(method.name())).append("'>\n");
        for (ArgInfo arg : method.args()) {
          xml.append("      <arg type='").append(arg.type().getSignature())
              .append("' name='").append(escape(arg.name()))
              .append("' direction='").append(arg.direction().getXmlName()).append("'/>\n");
        }
        xml.append("    </method>\n");
      }
      xml.append("  </interface>\n");
    }
    return xml.append("</node>\n").toString();
  }

  private static String escape(String text) {
    StringBuilder escaped = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '<' -> escaped.append("&lt;");
        case '>' -> escaped.append("&gt;");
        case '&' -> escaped.append("&amp;");
        case '\'' -> escaped.append("&apos;");
        case '"' -> escaped.append("&quot;");
        default -> escaped.append(c);
      }
    }
    return escaped.toString();
  }
}
