package com.gastos.mcpgateway.config;

import com.gastos.mcpgateway.tool.GetSheetSummaryTool;
import com.gastos.mcpgateway.tool.ListMySheetsTool;
import com.gastos.mcpgateway.tool.ToolRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ToolConfig {

    // registration order is the discovery order
    @Bean
    public ToolRegistry toolRegistry(ListMySheetsTool listMySheets, GetSheetSummaryTool getSheetSummary) {
        return new ToolRegistry()
                .register(listMySheets)
                .register(getSheetSummary);
    }
}
