package scheme;

import java.io.*;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.reflect.Method;
import java.nio.file.Files;
import java.util.*;
import java.util.function.BiPredicate;
import java.util.function.Consumer;
import java.util.jar.Manifest;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.lang.ClassLoader.getSystemClassLoader;
import static java.lang.String.format;
import static java.lang.System.*;
import static java.lang.invoke.MethodHandles.lookup;
import static java.lang.reflect.Modifier.isPublic;
import static java.lang.reflect.Modifier.isStatic;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Arrays.asList;
import static java.util.Arrays.stream;
import static java.util.Collections.*;
import static scheme.Scheme.Primitives.*;
import static scheme.SchemeReader.parseAll;
import static scheme.SchemeReader.parseOptional;

@SuppressWarnings("UnusedDeclaration")
public class Scheme {
    public static void main(String... args) throws Exception {
        if (args.length == 0) repl(new BufferedReader(new InputStreamReader(in)), out);
        else if (args[0].startsWith("(")) out.println(evalString(primitiveBindings(), args[0]));
        else out.println(runFile(asList(args)));
    }

    static final Map<String, Symbol> symbols = new HashMap<>();
    static final Lookup lookup = lookup();

    static boolean debug = Boolean.getBoolean("scheme.debug");
    static String home = getProperty("scheme.home", getProperty("user.dir"));
    static String prompt = getProperty("scheme.prompt", "Lisp>>> ");

    public final static class Symbol {
        public final String symbol;

        Symbol(String symbol) {
            this.symbol = symbol.intern();
        }

        public String toString() {
            return symbol;
        }

        public boolean equals(Object o) { //noinspection StringEquality
            return o instanceof Symbol && symbol == ((Symbol) o).symbol;
        }

        public int hashCode() {
            return symbol.hashCode();
        }
    }

    public final static class DottedList {
        public final List<Object> head;
        public final Object tail;

        public DottedList(List<?> head, Object tail) {
            if (head.isEmpty()) throw new IllegalArgumentException("dotted list needs an element before the dot");
            this.head = list(head.toArray());
            this.tail = tail;
        }

        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            DottedList that = (DottedList) o;
            return head.equals(that.head) && tail.equals(that.tail);
        }

        public int hashCode() {
            return 31 * head.hashCode() + tail.hashCode();
        }

        public String toString() {
            return show(this);
        }

        public List<Object> toList() {
            List<Object> list = new ArrayList<>(head);
            list.add(tail);
            return list;
        }
    }

    public interface Procedure {
        Object apply(List<Object> args) throws LispError;
    }

    @FunctionalInterface
    public interface Fn {
        Object apply(List<Object> args) throws LispError;
    }

    public final static class Primitive implements Procedure {
        public final String name;
        final Fn fn;

        public Primitive(String name, Fn fn) {
            this.name = name;
            this.fn = fn;
        }

        public Object apply(List<Object> args) throws LispError {
            return fn.apply(args);
        }

        public String toString() {
            return show(this);
        }
    }

    public final static class Lambda implements Procedure {
        public final List<String> params;
        public final String vararg;
        public final List<Object> body;
        public final Env closure;

        public Lambda(List<String> params, String vararg, List<Object> body, Env closure) {
            this.params = unmodifiableList(new ArrayList<>(params));
            this.vararg = vararg;
            this.body = list(body.toArray());
            this.closure = closure;
        }

        public Object apply(List<Object> args) throws LispError {
            if (vararg == null ? args.size() != params.size() : args.size() < params.size())
                throw new NumArgs(params.size(), args);
            if (body.isEmpty()) throw new BadSpecialForm("Procedure has no body", this);
            Env env = closure.bindVars(zip(params, args));
            if (vararg != null)
                env = env.bindVars(singletonList(binding(vararg, list(args.subList(params.size(), args.size()).toArray()))));
            debug("applying %s to %s", this, show(args));
            Object result = null;
            for (Object x : body) result = eval(env, x);
            return result;
        }

        public String toString() {
            return show(this);
        }
    }

    public static class Ref<T> {
        T value;

        public Ref(T value) {
            this.value = value;
        }

        public T get() {
            return value;
        }

        public void set(T value) {
            this.value = value;
        }
    }

    // A frame of name -> cell linked to the frame it was bound on. A frame sees only the cells its parent
    // had when it was bound, so later defines in the parent stay invisible while set! on a shared cell is seen by all.
    public final static class Env {
        final Env parent;
        final int visible;
        final Map<String, Integer> index = new HashMap<>();
        final List<Ref<Object>> cells = new ArrayList<>();

        Env(Env parent) {
            this.parent = parent;
            this.visible = parent == null ? 0 : parent.cells.size();
        }

        public static Env empty() {
            return new Env(null);
        }

        Ref<Object> lookup(String name) {
            int limit = cells.size();
            for (Env env = this; env != null; limit = env.visible, env = env.parent) {
                Integer i = env.index.get(name);
                if (i != null && i < limit) return env.cells.get(i);
            }
            return null;
        }

        public boolean isBound(String name) {
            return lookup(name) != null;
        }

        public Object getVar(String name) throws UnboundVar {
            Ref<Object> ref = lookup(name);
            if (ref == null) throw new UnboundVar("Getting an unbound variable", name);
            return ref.get();
        }

        public Object setVar(String name, Object value) throws UnboundVar {
            Ref<Object> ref = lookup(name);
            if (ref == null) throw new UnboundVar("Setting an unbound variable", name);
            ref.set(value);
            return value;
        }

        public Object defineVar(String name, Object value) {
            Ref<Object> ref = lookup(name);
            if (ref != null) ref.set(value);
            else add(name, value);
            return value;
        }

        // The first of several bindings with the same name is the one that is found.
        public Env bindVars(List<Map.Entry<String, Object>> bindings) {
            Env frame = new Env(this);
            for (Map.Entry<String, Object> binding : bindings)
                if (!frame.index.containsKey(binding.getKey())) frame.add(binding.getKey(), binding.getValue());
            return frame;
        }

        void add(String name, Object value) {
            index.put(name, cells.size());
            cells.add(new Ref<>(value));
        }
    }

    public static abstract class LispError extends Exception {
        LispError(String message) {
            super(message, null, false, false);
        }
    }

    public static class NumArgs extends LispError {
        public final long expected;
        public final List<Object> found;

        public NumArgs(long expected, List<Object> found) {
            super(format("Expected %d args; found values %s", expected, unwords(found)));
            this.expected = expected;
            this.found = found;
        }
    }

    public static class TypeMismatch extends LispError {
        public final String expected;
        public final Object found;

        public TypeMismatch(String expected, Object found) {
            super(format("Invalid type: expected %s, found %s", expected, show(found)));
            this.expected = expected;
            this.found = found;
        }
    }

    public static class ParseError extends LispError {
        public final String reason;
        public final int line, column;

        public ParseError(String reason, int line, int column) {
            super(format("Parse error at line %d, column %d: %s", line, column, reason));
            this.reason = reason;
            this.line = line;
            this.column = column;
        }
    }

    public static class BadSpecialForm extends LispError {
        public final Object form;

        public BadSpecialForm(String message, Object form) {
            super(message + ": " + show(form));
            this.form = form;
        }
    }

    public static class UnboundVar extends LispError {
        public final String name;

        public UnboundVar(String message, String name) {
            super(message + ": " + name);
            this.name = name;
        }
    }

    public static class Default extends LispError {
        public Default(String message) {
            super(message);
        }
    }

    @SuppressWarnings("unchecked")
    public static Object eval(Env env, Object x) throws LispError {
        if (x instanceof String || x instanceof Long || x instanceof Boolean
                || x instanceof Character || x instanceof DottedList) return x;
        if (x instanceof Symbol) return env.getVar(((Symbol) x).symbol);
        if (!(x instanceof List)) throw new BadSpecialForm("Unrecognized special form", x);

        List<Object> list = (List<Object>) x;
        if (list.isEmpty()) return list;
        Object first = list.get(0);
        List<Object> args = rest(list);

        if (first instanceof Symbol)
            switch (((Symbol) first).symbol) {
                case "quote":
                    if (args.size() == 1) return args.get(0);
                    break;
                case "if":
                    if (args.size() != 3) throw new NumArgs(3, args);
                    return eval(env, Boolean.FALSE.equals(eval(env, args.get(0))) ? args.get(2) : args.get(1));
                case "set!":
                    if (args.size() == 2 && args.get(0) instanceof Symbol)
                        return env.setVar(args.get(0).toString(), eval(env, args.get(1)));
                    break;
                case "define":
                    if (args.size() == 2 && args.get(0) instanceof Symbol)
                        return env.defineVar(args.get(0).toString(), eval(env, args.get(1)));
                    if (args.isEmpty()) break;
                    Object signature = args.get(0);
                    if (signature instanceof List && !((List) signature).isEmpty() && ((List) signature).get(0) instanceof Symbol) {
                        List<Object> params = (List<Object>) signature;
                        return env.defineVar(params.get(0).toString(), makeFunc(null, env, rest(params), rest(args)));
                    }
                    if (signature instanceof DottedList && ((DottedList) signature).head.get(0) instanceof Symbol) {
                        DottedList params = (DottedList) signature;
                        return env.defineVar(params.head.get(0).toString(),
                                makeFunc(show(params.tail), env, rest(params.head), rest(args)));
                    }
                    break;
                case "lambda":
                    if (args.isEmpty()) break;
                    if (args.get(0) instanceof List)
                        return makeFunc(null, env, (List<Object>) args.get(0), rest(args));
                    if (args.get(0) instanceof DottedList)
                        return makeFunc(show(((DottedList) args.get(0)).tail), env, ((DottedList) args.get(0)).head, rest(args));
                    if (args.get(0) instanceof Symbol)
                        return makeFunc(args.get(0).toString(), env, EMPTY_LIST, rest(args));
                    break;
            }

        Object fn = eval(env, first);
        List<Object> values = new ArrayList<>(args.size());
        for (Object arg : args) values.add(eval(env, arg));
        return apply(fn, unmodifiableList(values));
    }

    public static Object apply(Object fn, List<Object> args) throws LispError {
        if (fn instanceof Procedure) return ((Procedure) fn).apply(args);
        throw new BadSpecialForm("Not a procedure", fn);
    }

    static Lambda makeFunc(String vararg, Env env, List<Object> params, List<Object> body) {
        return new Lambda(vec(params.stream().map(Scheme::show)), vararg, body, env);
    }

    public static Env makeGlobalEnvironment(Map<String, Fn> primitives) {
        return Env.empty().bindVars(vec(primitives.entrySet().stream()
                .map(e -> binding(e.getKey(), new Primitive(e.getKey(), e.getValue())))));
    }

    public static Env primitiveBindings() {
        Env env = makeGlobalEnvironment(primitives());
        IO.install(env);
        return env;
    }

    public static Map<String, Fn> primitives() {
        Map<String, Fn> primitives = new LinkedHashMap<>(operators);
        register(Primitives.class, m -> primitives.put(unscramble(m.getName()), fn(m)));
        return primitives;
    }

    public static final class Primitives {
        interface LongOp { long apply(long a, long b) throws LispError; }
        interface LLPredicate { boolean test(long a, long b); }
        interface Unpacker<T> { T unpack(Object x) throws LispError; }

        static final Pattern integer = Pattern.compile("-?\\d+");
        static final Map<String, Fn> operators = new LinkedHashMap<>();
        static {
            operators.put("+", numericBinop((a, b) -> exact(Math::addExact, a, b)));
            operators.put("-", numericBinop((a, b) -> exact(Math::subtractExact, a, b)));
            operators.put("*", numericBinop((a, b) -> exact(Math::multiplyExact, a, b)));
            operators.put("/", numericBinop((a, b) -> exact((x, y) -> Math.floorDiv(dividend(x, y), y), a, nonZero(b))));
            operators.put("=", numBoolBinop((a, b) -> a == b));
            operators.put("<", numBoolBinop((a, b) -> a < b));
            operators.put(">", numBoolBinop((a, b) -> a > b));
            operators.put("/=", numBoolBinop((a, b) -> a != b));
            operators.put(">=", numBoolBinop((a, b) -> a >= b));
            operators.put("<=", numBoolBinop((a, b) -> a <= b));
            operators.put("&&", boolBinop(Primitives::unpackBool, (a, b) -> a && b));
            operators.put("||", boolBinop(Primitives::unpackBool, (a, b) -> a || b));
        }

        public static Object mod(List<Object> args) throws LispError {
            return numericBinop((a, b) -> Math.floorMod(a, nonZero(b))).apply(args);
        }

        public static Object quotient(List<Object> args) throws LispError {
            return numericBinop((a, b) -> exact((x, y) -> dividend(x, y) / y, a, nonZero(b))).apply(args);
        }

        public static Object remainder(List<Object> args) throws LispError {
            return numericBinop((a, b) -> a % nonZero(b)).apply(args);
        }

        public static Object stringEQP(List<Object> args) throws LispError {
            return boolBinop(Primitives::unpackStr, String::equals).apply(args);
        }

        public static Object stringLTP(List<Object> args) throws LispError {
            return boolBinop(Primitives::unpackStr, (String a, String b) -> a.compareTo(b) < 0).apply(args);
        }

        public static Object stringGTP(List<Object> args) throws LispError {
            return boolBinop(Primitives::unpackStr, (String a, String b) -> a.compareTo(b) > 0).apply(args);
        }

        public static Object stringLTEQP(List<Object> args) throws LispError {
            return boolBinop(Primitives::unpackStr, (String a, String b) -> a.compareTo(b) <= 0).apply(args);
        }

        public static Object stringGTEQP(List<Object> args) throws LispError {
            return boolBinop(Primitives::unpackStr, (String a, String b) -> a.compareTo(b) >= 0).apply(args);
        }

        public static Object car(List<Object> args) throws LispError {
            arity(1, args);
            Object x = args.get(0);
            if (x instanceof List && !((List) x).isEmpty()) return ((List) x).get(0);
            if (x instanceof DottedList) return ((DottedList) x).head.get(0);
            throw new TypeMismatch("pair", x);
        }

        public static Object cdr(List<Object> args) throws LispError {
            arity(1, args);
            Object x = args.get(0);
            if (x instanceof List && !((List) x).isEmpty()) return Scheme.list(((List) x).subList(1, ((List) x).size()).toArray());
            if (x instanceof DottedList) {
                DottedList pair = (DottedList) x;
                return pair.head.size() == 1 ? pair.tail : new DottedList(rest(pair.head), pair.tail);
            }
            throw new TypeMismatch("pair", x);
        }

        public static Object cons(List<Object> args) throws LispError {
            arity(2, args);
            Object x = args.get(0), y = args.get(1);
            if (y instanceof List) return Scheme.list(Scheme.cons(x, (List<?>) y).toArray());
            if (y instanceof DottedList) return new DottedList(Scheme.cons(x, ((DottedList) y).head), ((DottedList) y).tail);
            return new DottedList(singletonList(x), y);
        }

        public static Object list(List<Object> args) {
            return Scheme.list(args.toArray());
        }

        public static Object eqP(List<Object> args) throws LispError {
            return eqvP(args);
        }

        public static Object eqvP(List<Object> args) throws LispError {
            arity(2, args);
            return eqv(args.get(0), args.get(1));
        }

        public static Object equalP(List<Object> args) throws LispError {
            arity(2, args);
            return equal(args.get(0), args.get(1));
        }

        public static Object nullP(List<Object> args) throws LispError {
            arity(1, args);
            return EMPTY_LIST.equals(args.get(0));
        }

        public static Object symbolP(List<Object> args) throws LispError {
            arity(1, args);
            return args.get(0) instanceof Symbol;
        }

        public static Object stringP(List<Object> args) throws LispError {
            arity(1, args);
            return args.get(0) instanceof String;
        }

        public static Object numberP(List<Object> args) throws LispError {
            arity(1, args);
            return args.get(0) instanceof Long;
        }

        public static Object booleanP(List<Object> args) throws LispError {
            arity(1, args);
            return args.get(0) instanceof Boolean;
        }

        public static Object not(List<Object> args) throws LispError {
            arity(1, args);
            return Boolean.FALSE.equals(args.get(0));
        }

        static Fn numericBinop(LongOp op) {
            return args -> {
                if (args.size() < 2) throw new NumArgs(2, args);
                long result = unpackNum(args.get(0));
                for (Object x : rest(args)) result = op.apply(result, unpackNum(x));
                return result;
            };
        }

        static Fn numBoolBinop(LLPredicate op) {
            return boolBinop(Primitives::unpackNum, op::test);
        }

        static <T> Fn boolBinop(Unpacker<T> unpacker, BiPredicate<T, T> op) {
            return args -> {
                arity(2, args);
                return op.test(unpacker.unpack(args.get(0)), unpacker.unpack(args.get(1)));
            };
        }

        static long exact(LongOp op, long a, long b) throws LispError {
            try {
                return op.apply(a, b);
            } catch (ArithmeticException e) {
                throw new Default("Integer overflow");
            }
        }

        // The one quotient that does not fit in a long.
        static long dividend(long x, long y) {
            if (x == Long.MIN_VALUE && y == -1) throw new ArithmeticException("long overflow");
            return x;
        }

        static long nonZero(long n) throws LispError {
            if (n == 0) throw new Default("Division by zero");
            return n;
        }

        static void arity(int n, List<Object> args) throws NumArgs {
            if (args.size() != n) throw new NumArgs(n, args);
        }

        static Long unpackNum(Object x) throws LispError {
            if (x instanceof Long) return (Long) x;
            if (x instanceof String && integer.matcher(((String) x).trim()).matches())
                try {
                    return Long.parseLong(((String) x).trim());
                } catch (NumberFormatException e) {
                    throw new TypeMismatch("number", x);
                }
            if (x instanceof List && ((List) x).size() == 1) return unpackNum(((List) x).get(0));
            throw new TypeMismatch("number", x);
        }

        static String unpackStr(Object x) throws LispError {
            if (x instanceof String) return (String) x;
            if (x instanceof Long || x instanceof Boolean) return show(x);
            throw new TypeMismatch("string", x);
        }

        static Boolean unpackBool(Object x) throws LispError {
            if (x instanceof Boolean) return (Boolean) x;
            throw new TypeMismatch("boolean", x);
        }

        static boolean eqv(Object a, Object b) {
            if (a instanceof DottedList && b instanceof DottedList)
                return eqv(((DottedList) a).toList(), ((DottedList) b).toList());
            if (a instanceof List && b instanceof List) return every((List<?>) a, (List<?>) b, Primitives::eqv);
            if (a instanceof Procedure || b instanceof Procedure) return a == b;
            return Objects.equals(a, b);
        }

        static boolean equal(Object a, Object b) {
            if (a instanceof DottedList && b instanceof DottedList)
                return equal(((DottedList) a).toList(), ((DottedList) b).toList());
            if (a instanceof List && b instanceof List) return every((List<?>) a, (List<?>) b, Primitives::equal);
            return unpackEquals(a, b, Primitives::unpackNum) || unpackEquals(a, b, Primitives::unpackStr)
                    || unpackEquals(a, b, Primitives::unpackBool) || eqv(a, b);
        }

        static <T> boolean unpackEquals(Object a, Object b, Unpacker<T> unpacker) {
            try {
                return unpacker.unpack(a).equals(unpacker.unpack(b));
            } catch (LispError notOfThisType) {
                return false;
            }
        }
    }

    // Primitives that need the evaluator or the file system, bound into a global environment.
    static final class IO {
        static void install(Env env) {
            define(env, "apply", args -> {
                if (args.isEmpty()) throw new NumArgs(1, args);
                List<Object> rest = rest(args);
                if (rest.size() == 1 && rest.get(0) instanceof List) //noinspection unchecked
                    return Scheme.apply(args.get(0), (List<Object>) rest.get(0));
                return Scheme.apply(args.get(0), rest);
            });
            define(env, "load", args -> load(env, file(args)));
            define(env, "read-contents", args -> readContents(file(args)));
            define(env, "read-all", args -> Scheme.list(parseAll(readContents(file(args))).toArray()));
            define(env, "read", args -> {
                arity(1, args);
                if (!(args.get(0) instanceof String)) throw new TypeMismatch("string", args.get(0));
                return SchemeReader.parse((String) args.get(0));
            });
            define(env, "write", args -> {
                arity(1, args);
                out.println(show(args.get(0)));
                return true;
            });
        }

        static void define(Env env, String name, Fn fn) {
            env.defineVar(name, new Primitive(name, fn));
        }

        static Object load(Env env, File file) throws LispError {
            debug("loading: %s", file);
            Object result = EMPTY_LIST;
            for (Object x : parseAll(readContents(file))) result = eval(env, x);
            return result;
        }

        static File file(List<Object> args) throws LispError {
            arity(1, args);
            if (!(args.get(0) instanceof String)) throw new TypeMismatch("string", args.get(0));
            File file = new File((String) args.get(0));
            return file.isAbsolute() ? file : new File(home, file.getPath());
        }

        static String readContents(File file) throws LispError {
            try {
                return new String(Files.readAllBytes(file.toPath()), UTF_8);
            } catch (IOException e) {
                throw new Default(format("Could not read %s: %s", file, e));
            }
        }
    }

    static final Map<Character, String> charNames = new HashMap<>();
    static {
        SchemeReader.characterNames.forEach((name, c) -> charNames.put(c, name));
    }

    public static String show(Object x) {
        if (x instanceof String) return showString((String) x);
        if (x instanceof Boolean) return (Boolean) x ? "#t" : "#f";
        if (x instanceof Character) return "#\\" + charNames.getOrDefault(x, x.toString());
        if (x instanceof List) return "(" + unwords((List<?>) x) + ")";
        if (x instanceof DottedList)
            return "(" + unwords(((DottedList) x).head) + " . " + show(((DottedList) x).tail) + ")";
        if (x instanceof Primitive) return "<primitive:" + ((Primitive) x).name + ">";
        if (x instanceof Lambda) {
            Lambda f = (Lambda) x;
            return "(lambda (" + String.join(" ", vec(f.params.stream().map(Scheme::showString)))
                    + (f.vararg != null ? " . " + f.vararg : "") + ") ...)";
        }
        return String.valueOf(x);
    }

    static String showString(String s) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : s.toCharArray())
            switch (c) {
                case '"': sb.append("\\\""); break;
                case '\\': sb.append("\\\\"); break;
                case '\t': sb.append("\\t"); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                default: sb.append(c);
            }
        return sb.append('"').toString();
    }

    static String unwords(List<?> xs) {
        return xs.stream().map(Scheme::show).collect(Collectors.joining(" "));
    }

    static String evalString(Env env, String expr) {
        try {
            return show(eval(env, SchemeReader.parse(expr)));
        } catch (LispError e) {
            return e.getMessage();
        }
    }

    static String runFile(List<String> args) {
        Env env = primitiveBindings();
        env.defineVar("args", list(rest(args).toArray()));
        try {
            return show(eval(env, list(intern("load"), args.get(0))));
        } catch (LispError e) {
            return e.getMessage();
        }
    }

    static void repl(BufferedReader in, PrintStream out) throws IOException {
        Env env = primitiveBindings();
        debug("scheme.java %s", version());
        for (String line; ; ) {
            out.print(prompt);
            out.flush();
            if ((line = in.readLine()) == null || line.equals("quit")) return;
            try {
                Optional<Object> x = parseOptional(line);
                if (x.isPresent()) out.println(show(eval(env, x.get())));
            } catch (LispError e) {
                out.println(e.getMessage());
            }
        }
    }

    static String version() {
        String version = null;
        try (InputStream manifest = getSystemClassLoader().getResourceAsStream("META-INF/MANIFEST.MF")) {
            if (manifest != null)
                version = new Manifest(manifest).getMainAttributes().getValue("Implementation-Version");
        } catch (IOException e) {
            debug("could not read manifest: %s", e);
        }
        return version != null ? version : "<unknown>";
    }

    public static Symbol intern(String name) {
        return symbols.computeIfAbsent(name, Symbol::new);
    }

    static void register(Class<?> aClass, Consumer<? super Method> hook) {
        stream(aClass.getDeclaredMethods()).filter(m -> isPublic(m.getModifiers()) && isStatic(m.getModifiers()))
                .filter(m -> m.getParameterCount() == 1 && m.getParameterTypes()[0] == List.class).forEach(hook);
    }

    static Fn fn(Method m) {
        try {
            MethodHandle mh = lookup.unreflect(m);
            return args -> {
                try {
                    return mh.invoke(args);
                } catch (LispError | RuntimeException | Error e) {
                    throw e;
                } catch (Throwable t) {
                    throw uncheck(t);
                }
            };
        } catch (IllegalAccessException e) {
            throw uncheck(e);
        }
    }

    static String unscramble(String s) {
        return s.replaceAll("_", "-").replaceAll("GT", ">").replaceAll("EQ", "=")
                .replaceAll("LT", "<").replaceAll("EX$", "!").replaceAll("P$", "?");
    }

    static void debug(String format, Object... args) {
        if (debug) err.println(format(format, args));
    }

    static Map.Entry<String, Object> binding(String name, Object value) {
        return new AbstractMap.SimpleImmutableEntry<>(name, value);
    }

    static List<Map.Entry<String, Object>> zip(List<String> names, List<Object> values) {
        List<Map.Entry<String, Object>> bindings = new ArrayList<>();
        for (int i = 0; i < Math.min(names.size(), values.size()); i++) bindings.add(binding(names.get(i), values.get(i)));
        return bindings;
    }

    public static List<Object> list(Object... xs) {
        return unmodifiableList(new ArrayList<>(asList(xs)));
    }

    static <T> List<T> vec(Stream<T> coll) {
        return new ArrayList<>(coll.collect(Collectors.toList()));
    }

    static <T> List<T> rest(List<T> coll) {
        return coll.isEmpty() ? coll : coll.subList(1, coll.size());
    }

    static List<Object> cons(Object x, List<?> xs) {
        List<Object> list = new ArrayList<>();
        list.add(x);
        list.addAll(xs);
        return list;
    }

    static <T, U> boolean every(List<T> xs, List<U> ys, BiPredicate<? super T, ? super U> pred) {
        if (xs.size() != ys.size()) return false;
        for (int i = 0; i < xs.size(); i++)
            if (!pred.test(xs.get(i), ys.get(i))) return false;
        return true;
    }

    static RuntimeException uncheck(Throwable t) {
        return uncheckAndThrow(t);
    }

    static <T extends Throwable> T uncheckAndThrow(Throwable t) throws T { //noinspection unchecked
        throw (T) t;
    }
}
