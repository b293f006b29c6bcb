package integration.tower;

/**
 * Element of one level of a differential tower: either a constant or a reduced fraction of
 * polynomials in that level's generator with coefficients one level down.
 *
 * @param <C> constant type
 */
public sealed interface TowerElement<C> permits ConstantElement, FractionElement {

  /** Height of the level the element belongs to; constants live at {@code -1}. */
  int height();
}
