/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.tgs.common.memo;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * Projection from call arguments to a memoization cache key.
 *
 * Syntax is a single term or a parenthesised, comma-separated tuple of
 * terms.  A term is a parameter name, "self" for the receiver, or
 * "id(name)" to compare that argument by identity instead of equals().
 * E.g. "x", "(self, x)", "(x, id(y))".
 */
public class KeyExpression {

  private static final Pattern NAME =
          Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
  private static final Pattern ID_TERM =
          Pattern.compile("id\\(\\s*([A-Za-z_][A-Za-z0-9_]*)\\s*\\)");

  private final String text;
  private final List<Term> terms;

  private KeyExpression(String text, List<Term> terms) {
    this.text = text;
    this.terms = ImmutableList.copyOf(terms);
  }

  /**
   * Key on every argument, including the receiver if any, by value
   */
  public static KeyExpression allArgs(Signature sig) {
    List<Term> terms = new ArrayList<Term>();
    List<String> names = new ArrayList<String>();
    if (sig.hasReceiver()) {
      terms.add(new Term(Signature.SELF, false));
      names.add(Signature.SELF);
    }
    for (String param: sig.params()) {
      terms.add(new Term(param, false));
      names.add(param);
    }
    return new KeyExpression("(" + StringUtils.join(names, ", ") + ")",
                             terms);
  }

  /**
   * Parse a key expression and check it against the signature
   * @param text
   * @param sig
   * @return
   * @throws IllegalArgumentException if malformed or names unknown
   *        parameters
   */
  public static KeyExpression parse(String text, Signature sig) {
    String expr = StringUtils.strip(text);
    if (StringUtils.isEmpty(expr)) {
      throw new IllegalArgumentException("Empty key expression");
    }

    List<String> termTexts = new ArrayList<String>();
    if (expr.startsWith("(") && expr.endsWith(")") &&
        !ID_TERM.matcher(expr).matches()) {
      String inner = expr.substring(1, expr.length() - 1);
      String[] parts = StringUtils.splitPreserveAllTokens(inner, ',');
      for (int i = 0; i < parts.length; i++) {
        String part = StringUtils.strip(parts[i]);
        // Allow trailing comma, as in "(x,)"
        if (part.isEmpty() && i == parts.length - 1 && i > 0) {
          continue;
        }
        termTexts.add(part);
      }
    } else {
      termTexts.add(expr);
    }

    List<Term> terms = new ArrayList<Term>();
    for (String termText: termTexts) {
      terms.add(parseTerm(termText, text, sig));
    }
    return new KeyExpression(expr, terms);
  }

  private static Term parseTerm(String termText, String fullText,
                                Signature sig) {
    String name;
    boolean identity;
    Matcher idMatch = ID_TERM.matcher(termText);
    if (idMatch.matches()) {
      name = idMatch.group(1);
      identity = true;
    } else if (NAME.matcher(termText).matches()) {
      name = termText;
      identity = false;
    } else {
      throw new IllegalArgumentException("Bad term '" + termText +
                          "' in key expression '" + fullText + "'");
    }

    if (Signature.SELF.equals(name)) {
      if (!sig.hasReceiver()) {
        throw new IllegalArgumentException("Key expression '" + fullText +
                      "' uses " + Signature.SELF + " but " + sig +
                      " has no receiver");
      }
    } else if (!sig.hasParam(name)) {
      throw new IllegalArgumentException("Key expression '" + fullText +
                      "' names unknown parameter " + name + " of " + sig);
    }
    return new Term(name, identity);
  }

  /**
   * @param args
   * @return cache key for the call
   * @throws IllegalArgumentException if an argument can't be compared by
   *        value
   */
  public Object key(CallArgs args) {
    List<Object> key = new ArrayList<Object>(terms.size());
    for (Term term: terms) {
      Object val = args.get(term.name);
      if (term.identity) {
        key.add(new IdentityKey(val));
      } else {
        if (val != null && val.getClass().isArray()) {
          throw new IllegalArgumentException("Argument " + term.name +
              " is an array and can't be used as a cache key by value;" +
              " use id(" + term.name + ") or a collection");
        }
        key.add(val);
      }
    }
    return key;
  }

  @Override
  public String toString() {
    return text;
  }

  private static class Term {
    final String name;
    final boolean identity;

    Term(String name, boolean identity) {
      this.name = name;
      this.identity = identity;
    }
  }
}
