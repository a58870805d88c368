package kryon.kir.core;

/**
 * 节点样式：尺寸、颜色、边框、间距、字体、显示、flex 与定位，全部字段独立可选。
 *
 * <p>尺寸 setter 同时接受 {@code "100px"}、{@code "50%"}、{@code "auto"} 等文本形式，
 * 颜色 setter 接受 {@code "#rrggbb"} 或 {@code rgba(...)}。</p>
 */
public final class Style extends PropertyRecord<StyleField, Style> {

  public Style() {
    super(StyleField.class);
  }

  @Override
  protected Style self() {
    return this;
  }

  public Dimension width() { return dimension(StyleField.WIDTH); }
  public Style width(Dimension value) { return set(StyleField.WIDTH, value); }
  public Style width(String value) { return set(StyleField.WIDTH, value); }

  public Dimension height() { return dimension(StyleField.HEIGHT); }
  public Style height(Dimension value) { return set(StyleField.HEIGHT, value); }
  public Style height(String value) { return set(StyleField.HEIGHT, value); }

  public Dimension minWidth() { return dimension(StyleField.MIN_WIDTH); }
  public Style minWidth(Dimension value) { return set(StyleField.MIN_WIDTH, value); }
  public Style minWidth(String value) { return set(StyleField.MIN_WIDTH, value); }

  public Dimension maxWidth() { return dimension(StyleField.MAX_WIDTH); }
  public Style maxWidth(Dimension value) { return set(StyleField.MAX_WIDTH, value); }
  public Style maxWidth(String value) { return set(StyleField.MAX_WIDTH, value); }

  public Dimension minHeight() { return dimension(StyleField.MIN_HEIGHT); }
  public Style minHeight(Dimension value) { return set(StyleField.MIN_HEIGHT, value); }
  public Style minHeight(String value) { return set(StyleField.MIN_HEIGHT, value); }

  public Dimension maxHeight() { return dimension(StyleField.MAX_HEIGHT); }
  public Style maxHeight(Dimension value) { return set(StyleField.MAX_HEIGHT, value); }
  public Style maxHeight(String value) { return set(StyleField.MAX_HEIGHT, value); }

  public Color backgroundColor() { return color(StyleField.BACKGROUND_COLOR); }
  public Style backgroundColor(Color value) { return set(StyleField.BACKGROUND_COLOR, value); }
  public Style backgroundColor(String value) { return set(StyleField.BACKGROUND_COLOR, value); }

  public Color color() { return color(StyleField.COLOR); }
  public Style color(Color value) { return set(StyleField.COLOR, value); }
  public Style color(String value) { return set(StyleField.COLOR, value); }

  public Color borderColor() { return color(StyleField.BORDER_COLOR); }
  public Style borderColor(Color value) { return set(StyleField.BORDER_COLOR, value); }
  public Style borderColor(String value) { return set(StyleField.BORDER_COLOR, value); }

  public Double borderWidth() { return number(StyleField.BORDER_WIDTH); }
  public Style borderWidth(double value) { return set(StyleField.BORDER_WIDTH, value); }

  public Double borderRadius() { return number(StyleField.BORDER_RADIUS); }
  public Style borderRadius(double value) { return set(StyleField.BORDER_RADIUS, value); }

  public Double margin() { return number(StyleField.MARGIN); }
  public Style margin(double value) { return set(StyleField.MARGIN, value); }

  public Double marginTop() { return number(StyleField.MARGIN_TOP); }
  public Style marginTop(double value) { return set(StyleField.MARGIN_TOP, value); }

  public Double marginRight() { return number(StyleField.MARGIN_RIGHT); }
  public Style marginRight(double value) { return set(StyleField.MARGIN_RIGHT, value); }

  public Double marginBottom() { return number(StyleField.MARGIN_BOTTOM); }
  public Style marginBottom(double value) { return set(StyleField.MARGIN_BOTTOM, value); }

  public Double marginLeft() { return number(StyleField.MARGIN_LEFT); }
  public Style marginLeft(double value) { return set(StyleField.MARGIN_LEFT, value); }

  public Double padding() { return number(StyleField.PADDING); }
  public Style padding(double value) { return set(StyleField.PADDING, value); }

  public Double paddingTop() { return number(StyleField.PADDING_TOP); }
  public Style paddingTop(double value) { return set(StyleField.PADDING_TOP, value); }

  public Double paddingRight() { return number(StyleField.PADDING_RIGHT); }
  public Style paddingRight(double value) { return set(StyleField.PADDING_RIGHT, value); }

  public Double paddingBottom() { return number(StyleField.PADDING_BOTTOM); }
  public Style paddingBottom(double value) { return set(StyleField.PADDING_BOTTOM, value); }

  public Double paddingLeft() { return number(StyleField.PADDING_LEFT); }
  public Style paddingLeft(double value) { return set(StyleField.PADDING_LEFT, value); }

  public Double fontSize() { return number(StyleField.FONT_SIZE); }
  public Style fontSize(double value) { return set(StyleField.FONT_SIZE, value); }

  public String fontFamily() { return string(StyleField.FONT_FAMILY); }
  public Style fontFamily(String value) { return set(StyleField.FONT_FAMILY, value); }

  public String fontWeight() { return string(StyleField.FONT_WEIGHT); }
  public Style fontWeight(String value) { return set(StyleField.FONT_WEIGHT, value); }

  public String fontStyle() { return string(StyleField.FONT_STYLE); }
  public Style fontStyle(String value) { return set(StyleField.FONT_STYLE, value); }

  public Double lineHeight() { return number(StyleField.LINE_HEIGHT); }
  public Style lineHeight(double value) { return set(StyleField.LINE_HEIGHT, value); }

  public String textAlign() { return string(StyleField.TEXT_ALIGN); }
  public Style textAlign(String value) { return set(StyleField.TEXT_ALIGN, value); }

  public Boolean visible() { return bool(StyleField.VISIBLE); }
  public Style visible(boolean value) { return set(StyleField.VISIBLE, value); }

  public Double opacity() { return number(StyleField.OPACITY); }
  public Style opacity(double value) { return set(StyleField.OPACITY, value); }

  public String overflow() { return string(StyleField.OVERFLOW); }
  public Style overflow(String value) { return set(StyleField.OVERFLOW, value); }

  public Double flexGrow() { return number(StyleField.FLEX_GROW); }
  public Style flexGrow(double value) { return set(StyleField.FLEX_GROW, value); }

  public Double flexShrink() { return number(StyleField.FLEX_SHRINK); }
  public Style flexShrink(double value) { return set(StyleField.FLEX_SHRINK, value); }

  public Dimension flexBasis() { return dimension(StyleField.FLEX_BASIS); }
  public Style flexBasis(Dimension value) { return set(StyleField.FLEX_BASIS, value); }
  public Style flexBasis(String value) { return set(StyleField.FLEX_BASIS, value); }

  public String position() { return string(StyleField.POSITION); }
  public Style position(String value) { return set(StyleField.POSITION, value); }

  public Double x() { return number(StyleField.X); }
  public Style x(double value) { return set(StyleField.X, value); }

  public Double y() { return number(StyleField.Y); }
  public Style y(double value) { return set(StyleField.Y, value); }
}
