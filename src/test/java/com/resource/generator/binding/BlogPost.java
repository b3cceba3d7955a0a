package com.resource.generator.binding;

class BlogPost extends TestEntity {
}
