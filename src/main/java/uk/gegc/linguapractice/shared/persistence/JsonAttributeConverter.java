package uk.gegc.linguapractice.shared.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import org.springframework.util.StringUtils;

import java.util.function.Supplier;

/**
 * Stores a collection-valued attribute as JSON text.
 */
public abstract class JsonAttributeConverter<T> implements AttributeConverter<T, String> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper().findAndRegisterModules();

    private final TypeReference<T> typeRef;
    private final Supplier<T> emptyValue;

    protected JsonAttributeConverter(TypeReference<T> typeRef, Supplier<T> emptyValue) {
        this.typeRef = typeRef;
        this.emptyValue = emptyValue;
    }

    @Override
    public String convertToDatabaseColumn(T attribute) {
        try {
            return OBJECT_MAPPER.writeValueAsString(attribute == null ? emptyValue.get() : attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize " + typeRef.getType(), e);
        }
    }

    @Override
    public T convertToEntityAttribute(String dbData) {
        if (!StringUtils.hasText(dbData)) {
            return emptyValue.get();
        }
        try {
            T parsed = OBJECT_MAPPER.readValue(dbData, typeRef);
            return parsed != null ? parsed : emptyValue.get();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize " + typeRef.getType(), e);
        }
    }
}
