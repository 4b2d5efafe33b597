package io.github.panghy.pdbbridge.pdb.procedures;

import io.github.panghy.pdbbridge.pdb.CallStatus;
import io.github.panghy.pdbbridge.pdb.InMemoryProcedureRegistry;
import io.github.panghy.pdbbridge.pdb.Param;
import io.github.panghy.pdbbridge.pdb.ParamDef;
import io.github.panghy.pdbbridge.pdb.ParamType;
import io.github.panghy.pdbbridge.pdb.Procedure;
import io.github.panghy.pdbbridge.pdb.ProcedureInfo;
import io.github.panghy.pdbbridge.pdb.RgbColor;
import io.github.panghy.pdbbridge.pdb.Signature;

import java.util.List;
import java.util.Optional;

/**
 * Procedures for working with colors packed into a single integer
 * ("irgb" colors), so that bus callers can build and take apart colors
 * without a round trip per channel.
 */
public final class ColorProcedures {

  public static final String IRGB_NEW = "ggimp-irgb-new";
  public static final String IRGB_RED = "ggimp-irgb-red";
  public static final String IRGB_GREEN = "ggimp-irgb-green";
  public static final String IRGB_BLUE = "ggimp-irgb-blue";
  public static final String RGB_PARSE = "ggimp-rgb-parse";
  public static final String RGB_LIST = "ggimp-rgb-list";

  private static final String AUTHOR = "Glimmer Labs";

  private ColorProcedures() {
  }

  /**
   * Installs every color procedure.
   *
   * @param registry The registry to install into
   */
  public static void installAll(InMemoryProcedureRegistry registry) {
    registry.install(new ProcedureInfo(IRGB_NEW, "Create an integer-encoded RGB color", AUTHOR,
        Signature.of(
            new ParamDef(ParamType.INT32, "red", "Red component"),
            new ParamDef(ParamType.INT32, "green", "Green component"),
            new ParamDef(ParamType.INT32, "blue", "Blue component")),
        Signature.of(new ParamDef(ParamType.INT32, "color", "An irgb color."))),
        ColorProcedures::irgbNew);

    for (String component : List.of("red", "green", "blue")) {
      registry.install(new ProcedureInfo("ggimp-irgb-" + component, "Extract " + component + " component",
          AUTHOR,
          Signature.of(new ParamDef(ParamType.INT32, "color", "Integer-encoded RGB color")),
          Signature.of(new ParamDef(ParamType.INT32, component, "The " + component + " component."))),
          ColorProcedures::irgbComponent);
    }

    registry.install(new ProcedureInfo(RGB_PARSE, "Return the RGB integer corresponding to a color name", AUTHOR,
        Signature.of(new ParamDef(ParamType.STRING, "color-name", "The name of a color")),
        Signature.of(new ParamDef(ParamType.INT32, "color", "The RGB color packed into 32 bits"))),
        ColorProcedures::rgbParse);

    registry.install(new ProcedureInfo(RGB_LIST, "List all of the predefined colors", AUTHOR,
        Signature.empty(),
        Signature.of(
            new ParamDef(ParamType.INT32, "ncolors", "the number of colors returned"),
            new ParamDef(ParamType.STRINGARRAY, "colors", "a list of pre-defined rgb colors"))),
        ColorProcedures::rgbList);
  }

  // Channels are packed unclamped; callers are expected to pass 0-255.
  static List<Param> irgbNew(String name, List<Param> params) {
    int red = intArg(params, 0);
    int green = intArg(params, 1);
    int blue = intArg(params, 2);
    return success((red << 16) | (green << 8) | blue);
  }

  static List<Param> irgbComponent(String name, List<Param> params) {
    int shift;
    switch (name) {
      case IRGB_RED:
        shift = 16;
        break;
      case IRGB_GREEN:
        shift = 8;
        break;
      case IRGB_BLUE:
        shift = 0;
        break;
      default:
        return failure();
    }
    return success((intArg(params, 0) >> shift) & 255);
  }

  static List<Param> rgbParse(String name, List<Param> params) {
    String text = ((Param.StringParam) params.get(0)).value();
    Optional<RgbColor> color = NamedColors.parse(text);
    return color.map(c -> success(c.pack())).orElseGet(ColorProcedures::failure);
  }

  static List<Param> rgbList(String name, List<Param> params) {
    String[] names = NamedColors.names();
    return Procedure.success(
        Param.int32(names.length),
        new Param.StringArrayParam(names));
  }

  private static int intArg(List<Param> params, int index) {
    return ((Param.IntParam) params.get(index)).value();
  }

  private static List<Param> success(int value) {
    return Procedure.success(Param.int32(value));
  }

  private static List<Param> failure() {
    return Procedure.failure(CallStatus.CALLING_ERROR);
  }
}
