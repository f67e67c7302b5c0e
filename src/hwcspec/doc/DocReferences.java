package hwcspec.doc;

import hwcspec.SpecConsistencyException;
import hwcspec.data.ProductInfo;
import hwcspec.equation.EquationRenderer;
import hwcspec.view.CounterView;
import hwcspec.view.IndexedView;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds and resolves symbolic references in documentation text.
 * <p>
 * Supported references:
 * <ul>
 * <li>{@code {{K::GPU_NAME}}} inserts the product document name</li>
 * <li>{@code {{C::<MachineName>}}} inserts the human name of a counter</li>
 * <li>{@code {{C::<MachineName>.equation}}} inserts the authored equation of a counter</li>
 * </ul>
 */
public final class DocReferences {
  public static final Pattern TOKEN_PATTERN = Pattern.compile("\\{\\{(.*?)\\}\\}");

  private DocReferences() {}

  /**
   * Lists all references in a text, in order. Malformed references are returned as well, for the caller to check.
   * @param text documentation text
   * @return the references
   */
  public static List<DocReference> parse(String text) {
    List<DocReference> ret = new ArrayList<>();
    Matcher matcher = TOKEN_PATTERN.matcher(text);
    while (matcher.find())
      ret.add(toReference(matcher.group(0), matcher.group(1)));
    return ret;
  }

  private static DocReference toReference(String token, String body) {
    int sep = body.indexOf("::");
    String type = (sep < 0) ? body : body.substring(0, sep);
    String reference = (sep < 0) ? "" : body.substring(sep + 2);
    int dot = reference.indexOf('.');
    String name = (dot < 0) ? reference : reference.substring(0, dot);
    String part = (dot < 0) ? "" : reference.substring(dot + 1);
    return new DocReference(token, type, name, part);
  }

  /**
   * Replaces all references in a text with their values for one product.
   * @param text documentation text
   * @param view the product view used to look up counters
   * @param product the product, used for the document name
   * @return the resolved text
   * @throws SpecConsistencyException if a reference is malformed or its target does not exist
   */
  public static String resolveToText(String text, IndexedView view, ProductInfo product) {
    Matcher matcher = TOKEN_PATTERN.matcher(text);
    StringBuilder ret = new StringBuilder();
    while (matcher.find()) {
      DocReference reference = toReference(matcher.group(0), matcher.group(1));
      matcher.appendReplacement(ret, Matcher.quoteReplacement(resolve(reference, view, product)));
    }
    matcher.appendTail(ret);
    return ret.toString();
  }

  private static String resolve(DocReference reference, IndexedView view, ProductInfo product) {
    if (reference.isConstant() && reference.name().equals(DocReference.CONSTANT_GPU_NAME) && reference.part().isEmpty()) {
      return product.getDocumentName(true).orElseThrow(
          () -> new SpecConsistencyException("Product " + product.getName() + " has no document name for " + reference.token()));
    }
    if (reference.isCounter()) {
      CounterView counter = view.getByMachineName(reference.name()).orElseThrow(
          () -> new SpecConsistencyException("Bad doc reference target " + reference.token() + " for " + view.getProduct()));
      if (reference.part().isEmpty())
        return counter.getHumanName();
      if (reference.part().equals(DocReference.PART_EQUATION)) {
        return counter.getEquationAst().map(EquationRenderer::equationText).orElseThrow(
            () -> new SpecConsistencyException("Counter " + counter.getMachineName() + " has no equation for " + reference.token()));
      }
    }
    throw new SpecConsistencyException("Bad doc reference " + reference.token());
  }
}
