package com.reviewengine.core.scope;

import com.reviewengine.config.BuiltinNames;
import com.reviewengine.config.ResolutionMode;
import com.reviewengine.config.ResolutionModeResolver;
import com.reviewengine.core.syntax.ExprContext;
import com.reviewengine.core.syntax.NodeKind;
import com.reviewengine.core.syntax.SyntaxNode;
import com.reviewengine.core.syntax.SyntaxTree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * ScopeAnalyzer - single tree walk that classifies every identifier read.
 *
 * Bindings recognised:
 *   - Assign with a plain Name target          -> defined
 *   - For / AsyncFor with a plain Name target  -> loopBound
 *   - FunctionDef / AsyncFunctionDef params    -> defined
 *
 * Destructuring, attribute/subscript targets and comprehension variables are
 * not bindings, so names bound only that way are reported as undefined. With
 * declaration tracking enabled the analyzer additionally honours imports,
 * def/class names, except/with aliases, global/nonlocal, walrus, lambda
 * parameters, comprehension targets, augmented/annotated targets,
 * destructuring, match captures, type aliases and type parameters.
 *
 * In {@link ResolutionMode#ORDERED} a read is judged against the bindings
 * visited so far in {@link SyntaxTree#walk()} order. {@link ResolutionMode#TWO_PHASE}
 * judges every read after the walk.
 */
@Component
public class ScopeAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ScopeAnalyzer.class);

    private final Set<String> builtins;
    private final ResolutionMode mode;
    private final boolean trackDeclarations;

    @Autowired
    public ScopeAnalyzer(
            BuiltinNames builtinNames,
            ResolutionModeResolver modeResolver,
            @Value("${code-review.scope.track-declarations:false}") boolean trackDeclarations
    ) {
        this(builtinNames.getNames(), modeResolver.getMode(), trackDeclarations);
    }

    public ScopeAnalyzer(Set<String> builtins, ResolutionMode mode, boolean trackDeclarations) {
        this.builtins = Set.copyOf(builtins);
        this.mode = mode;
        this.trackDeclarations = trackDeclarations;
    }

    public ResolutionMode getMode() {
        return mode;
    }

    public ScopeAnalysis analyze(SyntaxTree tree) {
        Set<String> defined = new LinkedHashSet<>();
        Set<String> loopBound = new LinkedHashSet<>();
        Set<String> used = new LinkedHashSet<>();
        List<NameReference> reads = new ArrayList<>();
        List<NameReference> undefined = new ArrayList<>();

        for (SyntaxNode node : tree.walk()) {
            switch (node.getKind()) {
                case ASSIGN:
                    for (SyntaxNode target : node.getTargets()) {
                        bindTarget(target, defined);
                    }
                    break;

                case FOR:
                case ASYNC_FOR:
                    bindTarget(node.getTarget(), loopBound);
                    break;

                case FUNCTION_DEF:
                case ASYNC_FUNCTION_DEF:
                    for (SyntaxNode param : node.getParameters()) {
                        defined.add(param.getIdentifier());
                    }
                    if (trackDeclarations) {
                        defined.add(node.getIdentifier());
                    }
                    break;

                case NAME:
                    if (node.getContext() != ExprContext.LOAD) {
                        break;
                    }
                    String name = node.getIdentifier();
                    used.add(name);
                    NameReference reference = new NameReference(name, node.getLine());
                    if (mode == ResolutionMode.ORDERED) {
                        if (!isBound(name, defined, loopBound)) {
                            undefined.add(reference);
                        }
                    } else {
                        reads.add(reference);
                    }
                    break;

                default:
                    if (trackDeclarations) {
                        bindDeclaration(node, defined, loopBound);
                    }
                    break;
            }
        }

        for (NameReference read : reads) {
            if (!isBound(read.getName(), defined, loopBound)) {
                undefined.add(read);
            }
        }

        ScopeAnalysis analysis = new ScopeAnalysis(defined, loopBound, used, builtins, undefined);
        log.debug("[ScopeAnalyzer] {} ({} mode)", analysis, mode);
        return analysis;
    }

    private boolean isBound(String name, Set<String> defined, Set<String> loopBound) {
        return defined.contains(name) || loopBound.contains(name) || builtins.contains(name);
    }

    private void bindTarget(SyntaxNode target, Set<String> into) {
        if (target == null) {
            return;
        }
        if (target.getKind() == NodeKind.NAME) {
            into.add(target.getIdentifier());
        } else if (trackDeclarations) {
            bindDestructured(target, into);
        }
    }

    private static void bindDestructured(SyntaxNode target, Set<String> into) {
        switch (target.getKind()) {
            case NAME:
                into.add(target.getIdentifier());
                break;
            case TUPLE:
            case LIST:
                for (SyntaxNode elt : target.field("elts")) {
                    bindDestructured(elt, into);
                }
                break;
            case STARRED:
                bindDestructured(target.getValue(), into);
                break;
            default:
                break;
        }
    }

    private static void bindDeclaration(SyntaxNode node, Set<String> defined, Set<String> loopBound) {
        switch (node.getKind()) {
            case IMPORT:
                for (SyntaxNode alias : node.field("names")) {
                    String name = alias.getAsName() != null ? alias.getAsName() : alias.getIdentifier();
                    int dot = name.indexOf('.');
                    defined.add(dot >= 0 ? name.substring(0, dot) : name);
                }
                break;
            case IMPORT_FROM:
                for (SyntaxNode alias : node.field("names")) {
                    if (!"*".equals(alias.getIdentifier())) {
                        defined.add(alias.getAsName() != null ? alias.getAsName() : alias.getIdentifier());
                    }
                }
                break;
            case CLASS_DEF:
                defined.add(node.getIdentifier());
                break;
            case EXCEPT_HANDLER:
            case MATCH_AS:
            case MATCH_STAR:
            case MATCH_MAPPING:
            case TYPE_VAR:
            case PARAM_SPEC:
            case TYPE_VAR_TUPLE:
                if (node.getIdentifier() != null) {
                    defined.add(node.getIdentifier());
                }
                break;
            case WITH_ITEM:
                SyntaxNode vars = node.single("optional_vars");
                if (vars != null) {
                    bindDestructured(vars, defined);
                }
                break;
            case TYPE_ALIAS:
                bindDestructured(node.single("name"), defined);
                break;
            case GLOBAL:
            case NONLOCAL:
                defined.addAll(node.getNames());
                break;
            case NAMED_EXPR:
            case AUG_ASSIGN:
            case ANN_ASSIGN:
                bindDestructured(node.getTarget(), defined);
                break;
            case LAMBDA:
                for (SyntaxNode param : node.getParameters()) {
                    defined.add(param.getIdentifier());
                }
                break;
            case COMPREHENSION:
                bindDestructured(node.getTarget(), loopBound);
                break;
            default:
                break;
        }
    }
}
