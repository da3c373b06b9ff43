package scheme;

import org.junit.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static java.util.Arrays.asList;
import static java.util.Collections.EMPTY_LIST;
import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.junit.Assert.*;
import static scheme.Scheme.*;

public class SchemeTest {
    Env env = primitiveBindings();

    @Test
    public void self_evaluating() {
        is(42L, "42");
        is("foo", "\"foo\"");
        is(true, "#t");
        is(false, "#f");
        is('a', "#\\a");
        is(EMPTY_LIST, "()");
        is(new DottedList(asList(1L), 2L), "(1 . 2)");
    }

    @Test
    public void atoms_are_looked_up() {
        is(1L, "(define x 1)");
        is(1L, "x");
        assertThat(fails(UnboundVar.class, "y").name, equalTo("y"));
    }

    @Test
    public void quote() {
        is(intern("x"), "'x");
        is(intern("x"), "(quote x)");
        is(list(1L, list(intern("+"), 2L, 3L)), "'(1 (+ 2 3))");
    }

    @Test
    public void quote_with_wrong_arity_is_an_application() {
        assertThat(fails(UnboundVar.class, "(quote)").name, equalTo("quote"));
        assertThat(fails(UnboundVar.class, "(quote a b)").name, equalTo("quote"));
    }

    @Test
    public void _if() {
        is(2L, "(if #f 1 2)");
        is(1L, "(if #t 1 2)");
        is(1L, "(if (< 1 2) 1 2)");
    }

    @Test
    public void only_false_is_falsy() {
        is(1L, "(if 0 1 2)");
        is(1L, "(if '() 1 2)");
        is(1L, "(if \"\" 1 2)");
        is(1L, "(if 'f 1 2)");
    }

    @Test
    public void if_evaluates_one_branch() {
        is(0L, "(define hits 0)");
        is(1L, "(if #t (set! hits (+ hits 1)) (set! hits 100))");
        is(1L, "hits");
    }

    @Test
    public void malformed_if() {
        NumArgs e = fails(NumArgs.class, "(if #t 1)");
        assertThat(e.expected, equalTo(3L));
        assertThat(e.found, equalTo(asList(true, 1L)));
        assertThat(fails(NumArgs.class, "(if 1 2 3 4)").found.size(), equalTo(4));
        assertThat(fails(NumArgs.class, "(if)").found, equalTo(EMPTY_LIST));
    }

    @Test
    public void define_then_set() {
        is(1L, "(define x 1)");
        is(2L, "(set! x 2)");
        is(2L, "x");
        is(3L, "(define x 3)");
        is(3L, "x");
    }

    @Test
    public void set_of_unbound() {
        UnboundVar e = fails(UnboundVar.class, "(set! y 1)");
        assertThat(e.name, equalTo("y"));
        assertThat(e.getMessage(), equalTo("Setting an unbound variable: y"));
    }

    @Test
    public void define_procedures() {
        is(Lambda.class, "(define (square x) (* x x))");
        is(49L, "(square 7)");
        is(Lambda.class, "(define (factorial n) (if (= n 0) 1 (* n (factorial (- n 1)))))");
        is(3628800L, "(factorial 10)");
        is(Lambda.class, "(define (fib n) (if (< n 2) n (+ (fib (- n 1)) (fib (- n 2)))))");
        is(610L, "(fib 15)");
    }

    @Test
    public void define_variadic_procedures() {
        is(Lambda.class, "(define (tail first . rest) rest)");
        is(EMPTY_LIST, "(tail 1)");
        is(list(2L, 3L), "(tail 1 2 3)");
        is(Lambda.class, "(define (all . xs) xs)");
        is(EMPTY_LIST, "(all)");
        is(list(1L, 2L), "(all 1 2)");
    }

    @Test
    public void lambdas() {
        is(Lambda.class, "(lambda (x) x)");
        is(5L, "((lambda (x y) (+ x y)) 2 3)");
        is(1L, "((lambda () 1))");
        is(list(1L, list(2L, 3L)), "((lambda (x . y) (list x y)) 1 2 3)");
        is(list(1L, EMPTY_LIST), "((lambda (x . y) (list x y)) 1)");
        is(list(1L, 2L), "((lambda args args) 1 2)");
        is(EMPTY_LIST, "((lambda args args))");
    }

    @Test
    public void body_evaluates_in_order_and_returns_the_last_value() {
        is(EMPTY_LIST, "(define log '())");
        is(3L, "((lambda () (set! log (cons 1 log)) (set! log (cons 2 log)) 3))");
        is(list(2L, 1L), "log");
    }

    @Test
    public void arity() {
        is(Lambda.class, "(define (f a b) a)");
        NumArgs tooFew = fails(NumArgs.class, "(f 1)");
        assertThat(tooFew.expected, equalTo(2L));
        assertThat(tooFew.found, equalTo(asList(1L)));
        NumArgs tooMany = fails(NumArgs.class, "(f 1 2 3)");
        assertThat(tooMany.expected, equalTo(2L));
        assertThat(tooMany.found, equalTo(asList(1L, 2L, 3L)));
        assertThat(tooMany.getMessage(), equalTo("Expected 2 args; found values 1 2 3"));
    }

    @Test
    public void variadic_arity() {
        is(Lambda.class, "(define (g a . rest) a)");
        is(1L, "(g 1)");
        is(1L, "(g 1 2 3 4 5)");
        NumArgs e = fails(NumArgs.class, "(g)");
        assertThat(e.expected, equalTo(1L));
        assertThat(e.found, equalTo(EMPTY_LIST));
    }

    @Test
    public void first_duplicate_parameter_wins() {
        is(1L, "((lambda (x x) x) 1 2)");
    }

    @Test
    public void rest_parameter_binds_a_fresh_cell() {
        is(0L, "(define rest 0)");
        is(list(2L), "((lambda (x . rest) rest) 1 2)");
        is(0L, "rest");
    }

    @Test
    public void deep_recursion_through_many_globals() {
        for (int i = 0; i < 200; i++) is((long) i, "(define g" + i + " " + i + ")");
        is(Lambda.class, "(define (count n) (if (= n 0) 0 (+ 1 (count (- n 1)))))");
        is(500L, "(count 500)");
    }

    @Test
    public void parameters_do_not_leak() {
        is(Lambda.class, "(define (f local) local)");
        is(1L, "(f 1)");
        assertThat(fails(UnboundVar.class, "local").name, equalTo("local"));
        is(Lambda.class, "(define (g . rest) rest)");
        is(list(1L), "(g 1)");
        assertThat(fails(UnboundVar.class, "rest").name, equalTo("rest"));
    }

    @Test
    public void closures_capture_by_reference() {
        is(0L, "(define counter 0)");
        is(Lambda.class, "(define (get) counter)");
        is(5L, "(set! counter 5)");
        is(5L, "(get)");
    }

    @Test
    public void closure_sees_set_in_its_defining_scope() {
        is(Lambda.class, "(define (make) (define v 1) (define (get) v) (set! v 10) get)");
        is(10L, "((make))");
    }

    @Test
    public void closures_share_state() {
        is(Lambda.class, "(define (make-counter) (define n 0) (lambda () (set! n (+ n 1)) n))");
        is(Lambda.class, "(define c (make-counter))");
        is(1L, "(c)");
        is(2L, "(c)");
        is(Lambda.class, "(define d (make-counter))");
        is(1L, "(d)");
        is(3L, "(c)");
    }

    @Test
    public void two_closures_over_one_frame() {
        is(Lambda.class, "(define (make-cell x) (list (lambda () x) (lambda (y) (set! x y))))");
        is(List.class, "(define cell (make-cell 1))");
        is(1L, "((car cell))");
        is(7L, "((car (cdr cell)) 7)");
        is(7L, "((car cell))");
    }

    @Test
    public void define_of_a_captured_name_assigns_the_shared_cell() {
        is(1L, "(define n 1)");
        is(Lambda.class, "(define (f) (define n 2) n)");
        is(2L, "(f)");
        is(2L, "n");
    }

    @Test
    public void mutual_recursion_through_the_global_frame() {
        is(Lambda.class, "(define (even? n) (if (= n 0) #t (odd? (- n 1))))");
        is(Lambda.class, "(define (odd? n) (if (= n 0) #f (even? (- n 1))))");
        is(true, "(even? 10)");
        is(false, "(odd? 10)");
    }

    @Test
    public void arguments_evaluate_left_to_right() {
        is(EMPTY_LIST, "(define trace '())");
        is(Lambda.class, "(define (note x) (set! trace (cons x trace)) x)");
        is(list(1L, 2L, 3L), "(list (note 1) (note 2) (note 3))");
        is(list(3L, 2L, 1L), "trace");
    }

    @Test
    public void function_position_evaluates_before_arguments() {
        is(EMPTY_LIST, "(define trace '())");
        is(Lambda.class, "(define (note x) (set! trace (cons x trace)) x)");
        is(9L, "((note car) (note '(9)))");
        is(list(9L), "(car trace)");
        is(true, "(eq? (car (cdr trace)) car)");
    }

    @Test
    public void first_error_aborts_evaluation() {
        is(0L, "(define a 0)");
        is(0L, "(define b 0)");
        assertThat(fails(UnboundVar.class, "(list (set! a 1) nope (set! b 2))").name, equalTo("nope"));
        is(1L, "a");
        is(0L, "b");
    }

    @Test
    public void errors_from_primitives_pass_through() {
        is(Lambda.class, "(define (f) (car 1))");
        TypeMismatch e = fails(TypeMismatch.class, "(f)");
        assertThat(e.expected, equalTo("pair"));
        assertThat(e.found, equalTo(1L));
    }

    @Test
    public void applying_a_non_procedure() {
        BadSpecialForm e = fails(BadSpecialForm.class, "(1 2)");
        assertThat(e.form, equalTo(1L));
        assertThat(e.getMessage(), equalTo("Not a procedure: 1"));
        fails(BadSpecialForm.class, "(\"f\")");
    }

    @Test
    public void procedure_values_are_not_forms() {
        Primitive car = (Primitive) eval("car");
        try {
            Scheme.eval(env, car);
            fail();
        } catch (BadSpecialForm e) {
            assertThat(e.getMessage(), equalTo("Unrecognized special form: <primitive:car>"));
        } catch (LispError e) {
            fail(e.getMessage());
        }
    }

    @Test
    public void empty_body() {
        is(Lambda.class, "(lambda (x))");
        fails(BadSpecialForm.class, "((lambda (x)) 1)");
    }

    @Test
    public void malformed_special_forms_are_applications() {
        assertThat(fails(UnboundVar.class, "(define x)").name, equalTo("define"));
        assertThat(fails(UnboundVar.class, "(set! x)").name, equalTo("set!"));
        assertThat(fails(UnboundVar.class, "(lambda)").name, equalTo("lambda"));
        assertThat(fails(UnboundVar.class, "(define 1 2)").name, equalTo("define"));
    }

    @Test
    public void special_form_names_can_be_shadowed_only_in_application_position() {
        is(Lambda.class, "(define (lambda . xs) xs)");
        is(list(1L, 2L), "(lambda 1 2)");
        is(Lambda.class, "(lambda (x) x)");
    }

    @Test
    public void show_procedures() {
        is("(lambda (\"x\" \"y\") ...)", "(show-of (lambda (x y) x))");
        is("(lambda (\"x\" . rest) ...)", "(show-of (lambda (x . rest) x))");
        is("<primitive:+>", "(show-of +)");
    }

    @Test
    public void global_environment_from_a_custom_table() throws Exception {
        Map<String, Fn> table = new HashMap<>();
        table.put("twice", args -> (Long) args.get(0) * 2);
        Env custom = makeGlobalEnvironment(table);
        assertThat(Scheme.eval(custom, SchemeReader.parse("(twice 21)")), equalTo(84L / 2));
        assertThat(custom.getVar("twice"), instanceOf(Primitive.class));
        assertFalse(custom.isBound("+"));
    }

    @Test
    public void closure_environment_is_shared_not_copied() {
        is(Lambda.class, "(define (f) 1)");
        Lambda f = (Lambda) eval("f");
        assertThat(f.closure, sameInstance(env));
    }

    void is(Object expected, String source) {
        Object actual = eval(source);
        if (expected instanceof Class) assertThat(source, actual, instanceOf((Class<?>) expected));
        else assertThat(source, actual, equalTo(expected));
    }

    Object eval(String source) {
        env.defineVar("show-of", new Primitive("show-of", args -> show(args.get(0))));
        try {
            return Scheme.eval(env, SchemeReader.parse(source));
        } catch (LispError e) {
            throw new AssertionError(source + ": " + e.getMessage(), e);
        }
    }

    <T extends LispError> T fails(Class<T> error, String source) {
        try {
            Object result = Scheme.eval(env, SchemeReader.parse(source));
            fail("expected " + error.getSimpleName() + " from " + source + ", got " + show(result));
        } catch (LispError e) {
            assertThat(source, e, instanceOf(error));
            return error.cast(e);
        }
        throw new IllegalStateException();
    }
}
