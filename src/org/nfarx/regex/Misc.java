/*
 * @LICENSE@
 */

package org.nfarx.regex;

import java.util.AbstractQueue;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Queue;


/**
 * This class implements a bunch of possibly reusable, miscelaneous static
 * objects, interfaces, classes, and methods.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    static boolean isSet(int flags, int FLAG) {
        return (flags & FLAG) != 0;
    }

    static final class FlagMgr {
        
        private List<String> labels = new ArrayList<String>(4);
        private int defined = 0;
        boolean frozen = false;
        
        private boolean contains(int f, int g) {
            return (g | f) == f;
        }

        int next(String label) {
            if (frozen)
                throw new IllegalStateException("frozen FlagMgr");
            labels.add(label);
            int flag = 1 << (labels.size() - 1);
            defined |= flag;
            return flag;
        }

        int freezeAndCount() {
            frozen = true;
            return labels.size();
        }
        
        void check(int flags) {
            if (!contains(defined, flags)) {
                throw new IllegalArgumentException(
                    "unknown flags: " + (flags & ~defined));
            }
        }

        String stringFrom(int flags) {
            StringBuilder sb = new StringBuilder();
            int n = 0;
            while (flags != 0) {
                for (; (flags & 1) == 0; flags >>>= 1, ++n)
                    ;
                sb.append(sb.length() == 0 ? "" : ", ").append(labels.get(n));
                flags &= ~1;
            }
            return sb.toString();
        }
    }

    private static abstract class Escaper {
        abstract boolean esc(StringBuilder sb, int c);
    }

    private static final class MapEscaper extends Escaper {
        private final Map<Character, String> map =
                new HashMap<Character, String>();

        public boolean esc(StringBuilder sb, int c) {
            boolean ret = (c == (char) c) ? map.containsKey((char) c) : false;
            if (ret)
                sb.append(map.get((char) c));
            return ret;
        }

        MapEscaper map(Character c, String s) {
            map.put(c, s);
            return this;
        }

        MapEscaper backslash(String metachars) {
            for (char c : metachars.toCharArray()) {
                map(c, "\\" + c);
            }
            return this;
        }
    }

    private static final MapEscaper jsEscaper =
            new MapEscaper().map('\\', "\\\\").map('"', "\\\"");
    /*
     * every char the Tokenizer treats as meta outside a char class
     */
    private static final MapEscaper quoteEscaper =
            new MapEscaper().backslash("\\()|*+?.^$[]{}");
    private static final MapEscaper rxccEscaper =
            new MapEscaper().map('^', "\\^").map('-', "\\-").map(']', "\\]");

    private static final Escaper unicodeEscaper = new Escaper() {
        public boolean esc(StringBuilder sb, int c) {
            boolean ret = false;
            if (c < 0) {
                sb.append("0x" + Integer.toHexString(c));
                ret = true;
            } else if (c < 32 || 126 < c) {
                int mark = sb.length();
                sb.append(Integer.toHexString(c));
                while (sb.length() - mark < 4) {
                    sb.insert(mark, "0");
                }
                sb.insert(mark, "\\u");
                ret = true;
            }
            return ret;
        }
    };

    /**
     * A collection of singleton objects which implement methods used to create
     * Strings where certain characters are replaced by escape sequences.
     */
    enum Esc {

        /**
         * Java lang escaper - escapes " and \, non-printable-ASCII and beyond ->
         * \\u codes
         */
        JAVA(jsEscaper, unicodeEscaper),
        /**
         * Pattern quoting - every metachar gets a backslash, nothing else is
         * touched, so the result compiles back to a literal match.
         */
        QUOTE(quoteEscaper),
        /**
         * Char class rendering for diagnostics - class metachars plus Java
         * escapes.
         */
        RXCC(rxccEscaper, jsEscaper, unicodeEscaper);

        private final Escaper[] path;

        Esc(final Escaper... path) {
            this.path = path;
        }

        void esc(StringBuilder sb, int c) {
            for (Escaper e : path) {
                if (e.esc(sb, c))
                    return;
            }
            sb.append((char) c);
        }

        String esc(int c) {
            StringBuilder sb = new StringBuilder();
            esc(sb, c);
            return sb.toString();
        }

        void esc(StringBuilder sb, CharSequence cs) {
            for (int i = 0; i < cs.length(); ++i) {
                esc(sb, cs.charAt(i));
            }
        }

        String esc(CharSequence cs) {
            StringBuilder sb = new StringBuilder();
            esc(sb, cs);
            return sb.toString();
        }
    }

    
    static final class IdentitySetQueue<E> extends AbstractQueue<E> {
        
        final Map<E, Void> map = new IdentityHashMap<E, Void>();
        final LinkedList<E> list = new LinkedList<E>();

        public IdentitySetQueue() {
            super();
        }
        @Override
        public Iterator<E> iterator() {
            return list.iterator();
        }

        @Override
        public int size() {
            assert list.size() == map.size();
            return map.size();
        }

        public boolean offer(E o) {
            if (o == null || map.containsKey(o)) return false;
            map.put(o, null);
            return list.offer(o);
        }

        public E peek() {
            return list.peek();
        }

        public E poll() {
            if (isEmpty()) return null;
            E ret = list.poll();
            assert map.containsKey(ret);
            map.remove(ret);
            return ret;
        }        
    }

    /*
     * Generic digraph visitors
     */
    private interface SimpleVertex {
        Iterable<? extends SimpleEdge> edges();
    }
    private interface SimpleEdge {
        SimpleVertex vertex();
    }
    interface Vertex<E extends SimpleEdge> extends SimpleVertex {
        Iterable<E> edges();
    }
    interface Edge<V extends SimpleVertex> extends SimpleEdge {
         V vertex();
    }

    /**
     * Visits every vertex reachable from the start vertex exactly once, in
     * breadth first order. Vertex identity, not equals(), decides whether a
     * vertex was seen, so cyclic graphs terminate.
     */
    static abstract class BreadthFirstVisitor<V extends Vertex<E>, E extends Edge<V>> {
        
        final Map<V, Void> black = new IdentityHashMap<V, Void>(); 
        final Queue<V> gray = new IdentitySetQueue<V>();
        V vertex;
        
        final BreadthFirstVisitor<V, E> start(V init) {
            black.clear(); gray.clear();
            visitFrom(init);
            return this;
        }
        
        private void visitFrom(V init) {
            gray.offer(init);
            while (!gray.isEmpty()) {
                black.put(vertex = gray.remove(), null);
                visit(vertex);
                for (E edge : vertex.edges()) {
                    if (!black.containsKey(edge.vertex())) gray.offer(edge.vertex());
                }
            }
        }
        protected void visit(V vertex) {}
    }
}
