package com.e2eq.links.orchestration;

import com.e2eq.links.annotations.LinkedBy;
import com.e2eq.links.core.LinkType;
import com.e2eq.links.core.LinkableEntity;
import com.e2eq.links.exceptions.LinkEngineException;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Extracts desired links from {@link LinkedBy} fields and getters, using per-class bindings
 * computed once and cached.
 */
public class AnnotatedLinkExtractor {

    public static final class Binding {
        public final LinkType linkType;
        public final String member;
        public final MethodHandle accessor;

        Binding(LinkType linkType, String member, MethodHandle accessor) {
            this.linkType = linkType;
            this.member = member;
            this.accessor = accessor;
        }
    }

    private final Map<Class<?>, List<Binding>> metas = new ConcurrentHashMap<>();

    public List<Binding> bindingsOf(Class<?> clazz) {
        return metas.computeIfAbsent(clazz, AnnotatedLinkExtractor::buildBindings);
    }

    public Set<LinkType> linkTypesOf(Class<?> clazz) {
        Set<LinkType> out = EnumSet.noneOf(LinkType.class);
        for (Binding b : bindingsOf(clazz)) out.add(b.linkType);
        return out;
    }

    public List<DesiredLink> extract(LinkableEntity entity) {
        List<DesiredLink> out = new ArrayList<>();
        for (Binding b : bindingsOf(entity.getClass())) {
            Object val;
            try {
                val = b.accessor.invoke(entity);
            } catch (Throwable t) {
                throw new LinkEngineException("Unable to read " + entity.getClass().getSimpleName() + "." + b.member, t);
            }
            addLinks(out, b.linkType, val);
        }
        return out;
    }

    private static void addLinks(List<DesiredLink> out, LinkType linkType, Object val) {
        if (val == null) return;
        if (val instanceof Collection<?> c) {
            for (Object o : c) addLinks(out, linkType, o);
        } else if (val instanceof String s) {
            if (!s.isBlank()) out.add(DesiredLink.to(linkType, s));
        } else {
            String s = val.toString();
            if (!s.isBlank()) out.add(DesiredLink.to(linkType, s));
        }
    }

    private static List<Binding> buildBindings(Class<?> clazz) {
        List<Binding> props = new ArrayList<>();
        MethodHandles.Lookup lookup = MethodHandles.lookup();
        for (Class<?> c = clazz; c != null && c != Object.class; c = c.getSuperclass()) {
            for (Field f : c.getDeclaredFields()) {
                LinkedBy lb = f.getAnnotation(LinkedBy.class);
                if (lb == null) continue;
                try {
                    f.setAccessible(true);
                    props.add(new Binding(lb.value(), f.getName(), lookup.unreflectGetter(f)));
                } catch (IllegalAccessException | RuntimeException e) {
                    throw new LinkEngineException("Cannot access @LinkedBy field " + c.getSimpleName() + "." + f.getName(), e);
                }
            }
            for (Method m : c.getDeclaredMethods()) {
                LinkedBy lb = m.getAnnotation(LinkedBy.class);
                if (lb == null) continue;
                if (m.getParameterCount() != 0) {
                    throw new LinkEngineException("@LinkedBy method " + c.getSimpleName() + "." + m.getName() + " must not take parameters");
                }
                try {
                    m.setAccessible(true);
                    props.add(new Binding(lb.value(), m.getName(), lookup.unreflect(m)));
                } catch (IllegalAccessException | RuntimeException e) {
                    throw new LinkEngineException("Cannot access @LinkedBy method " + c.getSimpleName() + "." + m.getName(), e);
                }
            }
        }
        return List.copyOf(props);
    }
}
