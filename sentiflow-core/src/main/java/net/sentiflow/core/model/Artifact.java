package net.sentiflow.core.model;

import java.util.Objects;

/** 네임스페이스 안의 산출 레이어 하나 (밴드/마스크 래스터 또는 벡터) */
public record Artifact(String name, Type type) {

    public Artifact {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public static Artifact raster(String name) { return new Artifact(name, Type.RASTER); }

    public static Artifact vector(String name) { return new Artifact(name, Type.VECTOR); }

    public enum Type {
        RASTER, VECTOR;

        public static Type from(String s) {
            if (s == null) throw new IllegalArgumentException("artifact type is null");
            return Type.valueOf(s.toUpperCase());
        }
        public String code() { return name(); }

        /** 네임스페이스 디렉터리/요소 이름 */
        public String element() { return name().toLowerCase(); }
    }
}
