package com.visprog.generator.codegen.mapper;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.visprog.generator.model.NodePort;
import com.visprog.generator.model.PortDataType;
import com.visprog.generator.model.PortDirection;

import static org.assertj.core.api.Assertions.*;

class PortTypeMapperTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "EXECUTION | void     | ''",
            "BOOL      | bool     | false",
            "INT32     | int      | 0",
            "INT64     | long long | 0LL",
            "FLOAT     | float    | 0.0f",
            "DOUBLE    | double   | 0.0",
            "STRING    | std::string | '\"\"'",
            "VECTOR    | std::vector<float> | {}",
            "POINTER   | void*    | nullptr",
            "ANY       | auto     | 0",
            "CLASS     | auto     | 0"
    })
    void testTypeTable(PortDataType type, String cppType, String literal) {
        assertThat(PortTypeMapper.targetType(type)).isEqualTo(cppType);
        assertThat(PortTypeMapper.defaultLiteral(type)).isEqualTo(literal);
    }

    @Test
    void testMissingTypeDegradesGracefully() {
        assertThat(PortTypeMapper.targetType((PortDataType) null)).isEqualTo("auto");
        assertThat(PortTypeMapper.defaultLiteral(null)).isEqualTo("0");

        PortDataType unknown = PortDataType.fromString("bogus");
        assertThat(unknown).isEqualTo(PortDataType.ANY);
        assertThat(PortTypeMapper.targetType(unknown)).isEqualTo("auto");
        assertThat(PortTypeMapper.defaultLiteral(unknown)).isEqualTo("0");
    }

    @Test
    void testPortTypeNameOverridesTable() {
        NodePort port = NodePort.builder()
                .id("n-obj")
                .dataType(PortDataType.OBJECT)
                .direction(PortDirection.INPUT)
                .typeName("Player*")
                .build();

        assertThat(PortTypeMapper.targetType(port)).isEqualTo("Player*");
    }
}
