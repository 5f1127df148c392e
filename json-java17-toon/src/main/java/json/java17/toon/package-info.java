/// TOON codec for the `json.java17` tree model.
///
/// TOON is an indentation-based notation for JSON data that writes arrays of
/// uniform objects as tables:
/// ```
/// users[2]{id,name,role}:
///   1,Alice,admin
///   2,Bob,user
/// tags[3]: admin,ops,dev
/// ```
///
/// {@link json.java17.toon.Toon} is the entry point. Encoding normalizes the tree with
/// {@link json.java17.toon.Normalizer}, picks each array's layout with
/// {@link json.java17.toon.ArrayShape} and quotes strings per
/// {@link json.java17.toon.Quoting}. Decoding scans and parses in one pass; the first
/// array header fixes the document delimiter.
///
/// Logging uses `java.util.logging` under the `json.java17.toon` logger names:
/// `FINE` for entry points, `FINER` and `FINEST` for parser and classifier detail.
package json.java17.toon;
