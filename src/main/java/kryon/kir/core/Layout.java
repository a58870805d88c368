package kryon.kir.core;

/**
 * 节点布局：flex 方向、对齐、间隙与四边偏移。
 */
public final class Layout extends PropertyRecord<LayoutField, Layout> {

  public Layout() {
    super(LayoutField.class);
  }

  @Override
  protected Layout self() {
    return this;
  }

  public String flexDirection() { return string(LayoutField.FLEX_DIRECTION); }
  public Layout flexDirection(String value) { return set(LayoutField.FLEX_DIRECTION, value); }

  public String justifyContent() { return string(LayoutField.JUSTIFY_CONTENT); }
  public Layout justifyContent(String value) { return set(LayoutField.JUSTIFY_CONTENT, value); }

  public String alignItems() { return string(LayoutField.ALIGN_ITEMS); }
  public Layout alignItems(String value) { return set(LayoutField.ALIGN_ITEMS, value); }

  public String alignContent() { return string(LayoutField.ALIGN_CONTENT); }
  public Layout alignContent(String value) { return set(LayoutField.ALIGN_CONTENT, value); }

  public Double gap() { return number(LayoutField.GAP); }
  public Layout gap(double value) { return set(LayoutField.GAP, value); }

  public Double rowGap() { return number(LayoutField.ROW_GAP); }
  public Layout rowGap(double value) { return set(LayoutField.ROW_GAP, value); }

  public Double columnGap() { return number(LayoutField.COLUMN_GAP); }
  public Layout columnGap(double value) { return set(LayoutField.COLUMN_GAP, value); }

  public String flexWrap() { return string(LayoutField.FLEX_WRAP); }
  public Layout flexWrap(String value) { return set(LayoutField.FLEX_WRAP, value); }

  public Double top() { return number(LayoutField.TOP); }
  public Layout top(double value) { return set(LayoutField.TOP, value); }

  public Double right() { return number(LayoutField.RIGHT); }
  public Layout right(double value) { return set(LayoutField.RIGHT, value); }

  public Double bottom() { return number(LayoutField.BOTTOM); }
  public Layout bottom(double value) { return set(LayoutField.BOTTOM, value); }

  public Double left() { return number(LayoutField.LEFT); }
  public Layout left(double value) { return set(LayoutField.LEFT, value); }
}
